/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.restroute;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * String helpers shared by the route derivation internals.
 */
@ThreadSafe
final class Utilities {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * A "stronger" version of {@link String#trim()} which also discards Unicode separator characters,
	 * e.g. {@code U+202F "Narrow No-Break Space"} pasted into an annotation value.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	@Nullable
	static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	/**
	 * Splits PascalCase text into fragments, each starting at an uppercase ASCII letter and running until the next one.
	 * <p>
	 * For example, {@code "UserProfile"} becomes {@code [User, Profile]} and {@code "HTMLPage"} becomes {@code [H, T, M, L, Page]}.
	 * Text before the first uppercase letter is not a fragment; callers decide whether that is legal.
	 *
	 * @param string the text to split
	 * @return the fragments, or the empty list if there are none
	 */
	@NonNull
	static List<String> splitAtUppercase(@NonNull String string) {
		requireNonNull(string);

		List<String> fragments = new ArrayList<>();
		int start = -1;

		for (int i = 0; i < string.length(); i++) {
			if (isAsciiUppercase(string.charAt(i))) {
				if (start >= 0)
					fragments.add(string.substring(start, i));

				start = i;
			}
		}

		if (start >= 0)
			fragments.add(string.substring(start));

		return Collections.unmodifiableList(fragments);
	}

	/**
	 * Like {@link #splitAtUppercase(String)}, but text before the first uppercase letter is kept as the first fragment,
	 * so {@code "apiUser"} becomes {@code [api, User]}.
	 *
	 * @param string the text to split
	 * @return the fragments, or the empty list if {@code string} is empty
	 */
	@NonNull
	static List<String> splitIntoWords(@NonNull String string) {
		requireNonNull(string);

		List<String> words = new ArrayList<>();
		int start = 0;

		for (int i = 1; i < string.length(); i++) {
			if (isAsciiUppercase(string.charAt(i))) {
				words.add(string.substring(start, i));
				start = i;
			}
		}

		if (start < string.length())
			words.add(string.substring(start));

		return Collections.unmodifiableList(words);
	}

	/**
	 * The last {@code /}-delimited component of {@code path}, e.g. {@code "comment"} for {@code "blog/comment"}.
	 *
	 * @param path the path
	 * @return the basename
	 */
	@NonNull
	static String basename(@NonNull String path) {
		requireNonNull(path);

		String trimmed = path;

		while (trimmed.length() > 1 && trimmed.endsWith("/"))
			trimmed = trimmed.substring(0, trimmed.length() - 1);

		int lastSlashIndex = trimmed.lastIndexOf('/');
		return lastSlashIndex < 0 ? trimmed : trimmed.substring(lastSlashIndex + 1);
	}

	static boolean isAsciiUppercase(char c) {
		return c >= 'A' && c <= 'Z';
	}

	static boolean isAsciiLowercase(char c) {
		return c >= 'a' && c <= 'z';
	}
}
