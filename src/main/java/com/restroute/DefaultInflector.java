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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Rule-based English pluralization.
 * <p>
 * Words are checked against uncountable nouns, then irregular nouns, then suffix rules (first match wins).
 * The case of the first letter is preserved, so {@code Person} becomes {@code People}.
 */
@ThreadSafe
final class DefaultInflector implements Inflector {
	@NonNull
	private static final DefaultInflector DEFAULT_INSTANCE;
	@NonNull
	private static final Set<String> UNCOUNTABLE_WORDS;
	@NonNull
	private static final Map<String, String> IRREGULAR_PLURALS_BY_SINGULAR;
	@NonNull
	private static final List<Rule> RULES;

	static {
		UNCOUNTABLE_WORDS = Set.of(
				"audio", "bison", "chassis", "data", "deer", "equipment", "feedback", "fish", "information", "jeans",
				"metadata", "money", "moose", "news", "police", "rice", "series", "sheep", "species", "staff", "traffic");

		Map<String, String> irregularPluralsBySingular = new LinkedHashMap<>();
		irregularPluralsBySingular.put("child", "children");
		irregularPluralsBySingular.put("foot", "feet");
		irregularPluralsBySingular.put("goose", "geese");
		irregularPluralsBySingular.put("man", "men");
		irregularPluralsBySingular.put("mouse", "mice");
		irregularPluralsBySingular.put("ox", "oxen");
		irregularPluralsBySingular.put("person", "people");
		irregularPluralsBySingular.put("tooth", "teeth");
		irregularPluralsBySingular.put("woman", "women");
		IRREGULAR_PLURALS_BY_SINGULAR = Collections.unmodifiableMap(irregularPluralsBySingular);

		List<Rule> rules = new ArrayList<>();
		rules.add(new Rule("(quiz)$", "$1zes"));
		rules.add(new Rule("^(ox)$", "$1en"));
		rules.add(new Rule("(matr|vert|ind)(ix|ex)$", "$1ices"));
		rules.add(new Rule("(x|ch|ss|sh)$", "$1es"));
		rules.add(new Rule("([^aeiouy]|qu)y$", "$1ies"));
		rules.add(new Rule("(hive)$", "$1s"));
		rules.add(new Rule("(?:([^f])fe|([lr])f)$", "$1$2ves"));
		rules.add(new Rule("sis$", "ses"));
		rules.add(new Rule("([ti])um$", "$1a"));
		rules.add(new Rule("(buffal|tomat|potat|her)o$", "$1oes"));
		rules.add(new Rule("(bu)s$", "$1ses"));
		rules.add(new Rule("(alias|status|campus)$", "$1es"));
		rules.add(new Rule("(octop|vir)us$", "$1i"));
		rules.add(new Rule("s$", "s"));
		rules.add(new Rule("$", "s"));
		RULES = Collections.unmodifiableList(rules);

		DEFAULT_INSTANCE = new DefaultInflector();
	}

	@NonNull
	public static DefaultInflector defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultInflector() {
		// Only one instance needed
	}

	@NonNull
	@Override
	public String pluralize(@NonNull String word) {
		requireNonNull(word);

		if (word.isEmpty())
			return word;

		String lowercaseWord = word.toLowerCase(Locale.ROOT);

		if (UNCOUNTABLE_WORDS.contains(lowercaseWord))
			return word;

		String irregularPlural = IRREGULAR_PLURALS_BY_SINGULAR.get(lowercaseWord);

		if (irregularPlural != null)
			return Character.isUpperCase(word.charAt(0))
					? Character.toUpperCase(irregularPlural.charAt(0)) + irregularPlural.substring(1)
					: irregularPlural;

		for (Rule rule : RULES) {
			Matcher matcher = rule.pattern().matcher(word);

			if (matcher.find())
				return matcher.replaceFirst(rule.replacement());
		}

		return word;
	}

	private record Rule(@NonNull Pattern pattern, @NonNull String replacement) {
		Rule(@NonNull String regex, @NonNull String replacement) {
			this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
		}
	}
}
