package org.javai.gura;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import org.javai.gura.value.GuraArray;
import org.javai.gura.value.GuraBigInteger;
import org.javai.gura.value.GuraFloat;
import org.javai.gura.value.GuraInteger;
import org.javai.gura.value.GuraNull;
import org.javai.gura.value.GuraObject;
import org.javai.gura.value.GuraString;
import org.javai.gura.value.GuraValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GuraParser")
class GuraParserTest {

	private final GuraParser parser = new GuraParser();

	static Path fixture(String name) {
		try {
			return Path.of(GuraParserTest.class.getResource("/fixtures/" + name).toURI());
		} catch (URISyntaxException e) {
			throw new IllegalStateException(e);
		}
	}

	static GuraArray ints(long... values) {
		return new GuraArray(Arrays.stream(values).<GuraValue>mapToObj(GuraInteger::new).toList());
	}

	static GuraArray strings(String... values) {
		return new GuraArray(Arrays.stream(values).<GuraValue>map(GuraString::new).toList());
	}

	private static void assertFailure(String text, ErrorKind kind, int position, int line) {
		assertThatThrownBy(() -> new GuraParser().parse(text))
				.isInstanceOfSatisfying(GuraParseException.class, e -> {
					assertThat(e.kind()).isEqualTo(kind);
					assertThat(e.position()).as("position").isEqualTo(position);
					assertThat(e.line()).as("line").isEqualTo(line);
				});
	}

	/**
	 * Contents of {@code fixtures/full.ura}.
	 */
	static GuraObject fullDocument() {
		return GuraObject.builder()
				.put("a_string", "test string")
				.put("int1", 99)
				.put("int2", 42)
				.put("int3", 0)
				.put("int4", -17)
				.put("int5", 1000)
				.put("int6", 5349221)
				.put("int7", 5349221)
				.put("hex1", 3735928559L)
				.put("hex2", 3735928559L)
				.put("hex3", 3735928559L)
				.put("oct1", 342391)
				.put("oct2", 493)
				.put("bin1", 214)
				.put("flt1", 1.0)
				.put("flt2", 3.1415)
				.put("flt3", -0.01)
				.put("flt4", 5e22)
				.put("flt5", 1e6)
				.put("flt6", -2e-2)
				.put("flt7", 6.626e-34)
				.put("flt8", 224617.445991228)
				.put("sf1", Double.POSITIVE_INFINITY)
				.put("sf2", Double.POSITIVE_INFINITY)
				.put("sf3", Double.NEGATIVE_INFINITY)
				.put("null", GuraNull.INSTANCE)
				.put("bool1", true)
				.put("bool2", false)
				.put("1234", "1234")
				.put("services", GuraObject.builder()
						.put("nginx", GuraObject.builder().put("host", "127.0.0.1").put("port", 80).build())
						.put("apache", GuraObject.builder().put("virtual_host", "10.10.10.4").put("port", 81).build())
						.build())
				.put("integers", ints(1, 2, 3))
				.put("colors", strings("red", "yellow", "green"))
				.put("nested_arrays_of_ints", GuraArray.of(ints(1, 2), ints(3, 4, 5)))
				.put("nested_mixed_array", GuraArray.of(ints(1, 2), strings("a", "b", "c")))
				.put("numbers", GuraArray.of(new GuraFloat(0.1), new GuraFloat(0.2), new GuraFloat(0.5),
						new GuraInteger(1), new GuraInteger(2), new GuraInteger(5)))
				.put("tango_singers", GuraArray.of(
						GuraObject.builder().put("user1", GuraObject.builder()
								.put("name", "Carlos")
								.put("surname", "Gardel")
								.put("year_of_birth", 1890)
								.build()).build(),
						GuraObject.builder().put("user2", GuraObject.builder()
								.put("name", "An\u00edbal")
								.put("surname", "Troilo")
								.put("year_of_birth", 1914)
								.build()).build()))
				.put("integers2", ints(1, 2, 3))
				.put("integers3", ints(1, 2))
				.put("my_server", GuraObject.builder()
						.put("host", "127.0.0.1")
						.put("port", 8080)
						.put("native_auth", true)
						.build())
				.put("gura_is_cool", "Gura is cool")
				.build();
	}

	@Test
	void fullDocumentFromFile() {
		assertThat(parser.parse(fixture("full.ura"))).isEqualTo(fullDocument());
	}

	@Test
	void keysKeepDocumentOrder() {
		GuraObject parsed = parser.parse("zeta: 1\nalpha: 2\nmid: 3");

		assertThat(parsed.keys()).containsExactly("zeta", "alpha", "mid");
	}

	@Test
	void facadeUsesDefaultConfiguration() {
		assertThat(Gura.parse("answer: 42").get("answer").asLong()).isEqualTo(42);
	}

	@Nested
	@DisplayName("Strings")
	class Strings {

		private String value(String literal) {
			return parser.parse("s: " + literal).get("s").asString();
		}

		@Test
		void escapeSequences() {
			assertThat(value("\"a\\tb\\n\\\"q\\\" \\\\ \\$\"")).isEqualTo("a\tb\n\"q\" \\ $");
		}

		@Test
		void unknownEscapeIsKeptVerbatim() {
			assertThat(value("\"\\q\"")).isEqualTo("\\q");
		}

		@Test
		void unicodeEscapes() {
			assertThat(value("\"\\u00e9 \\U0001F600\"")).isEqualTo("\u00e9 " + new String(Character.toChars(0x1F600)));
		}

		@Test
		void surrogateEscapeIsRejected() {
			assertThatThrownBy(() -> value("\"\\uD800\""))
					.isInstanceOf(GuraParseException.class)
					.hasMessageContaining("Bad hex value");
		}

		@Test
		void multilineBasicStringDropsFirstNewLine() {
			assertThat(value("\"\"\"\nline1\nline2\"\"\"")).isEqualTo("line1\nline2");
		}

		@Test
		void lineContinuationSkipsLeadingBlanks() {
			assertThat(value("\"\"\"\nThe quick \\\n    brown fox\"\"\"")).isEqualTo("The quick brown fox");
		}

		@Test
		void variablesAreInterpolated() {
			GuraObject parsed = parser.parse("$name: \"Gura\"\n$port: 8080\n"
					+ "greeting: \"Hello $name\"\nurl: \"localhost:$port\"");

			assertThat(parsed.get("greeting").asString()).isEqualTo("Hello Gura");
			assertThat(parsed.get("url").asString()).isEqualTo("localhost:8080");
		}

		@Test
		void literalStringsAreRaw() {
			assertThat(value("'C:\\Users\\$x'")).isEqualTo("C:\\Users\\$x");
		}

		@Test
		void multilineLiteralString() {
			assertThat(value("'''\nraw\n  text'''")).isEqualTo("raw\n  text");
		}

		@Test
		void unterminatedStringReportsEndOfInput() {
			assertFailure("a: \"abc", ErrorKind.SYNTAX, 7, 1);
		}
	}

	@Nested
	@DisplayName("Numbers")
	class Numbers {

		@Test
		void allNotations() {
			GuraObject parsed = parser.parse("i: 1_000\nh: 0xff\no: 0o17\nb: 0b101\nf: 3.14\ne: 6e-2\n"
					+ "pos: inf\nneg: -inf\nbig: 9223372036854775808");

			assertThat(parsed).isEqualTo(GuraObject.builder()
					.put("i", 1000)
					.put("h", 255)
					.put("o", 15)
					.put("b", 5)
					.put("f", 3.14)
					.put("e", 0.06)
					.put("pos", Double.POSITIVE_INFINITY)
					.put("neg", Double.NEGATIVE_INFINITY)
					.put("big", new GuraBigInteger(new BigInteger("9223372036854775808")))
					.build());
		}

		@Test
		void classification() {
			GuraObject parsed = parser.parse("a: 1\nb: 1.0\nc: 1e3\nd: 1E-2\ne: 0x1A\nf: nan");

			assertThat(parsed.get("a")).isInstanceOf(GuraInteger.class);
			assertThat(parsed.get("b")).isEqualTo(new GuraFloat(1.0));
			assertThat(parsed.get("c")).isEqualTo(new GuraFloat(1000.0));
			assertThat(parsed.get("d")).isEqualTo(new GuraFloat(0.01));
			assertThat(parsed.get("e")).isEqualTo(new GuraInteger(26));
			assertThat(parsed.get("f").asDouble()).isNaN();
		}

		@Test
		void nanValues() {
			GuraObject parsed = parser.parse(fixture("nan.ura"));

			assertThat(parsed.size()).isEqualTo(3);
			parsed.members().values().forEach(value -> assertThat(value.asDouble()).isNaN());
		}

		@Test
		void malformedNumber() {
			assertThatThrownBy(() -> parser.parse("x: 1.2.3"))
					.isInstanceOfSatisfying(GuraParseException.class,
							e -> assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX))
					.hasMessage("'1.2.3' is not a valid number");
		}
	}

	@Nested
	@DisplayName("Arrays")
	class ArrayValues {

		@Test
		void trailingCommaIsOptional() {
			assertThat(parser.parse("a: [1, 2,]").get("a")).isEqualTo(ints(1, 2));
		}

		@Test
		void trailingCommaBeforeClosingLine() {
			assertThat(parser.parse("a: [\n    1,\n    2,\n    3,\n]").get("a")).isEqualTo(ints(1, 2, 3));
		}

		@Test
		void emptyArray() {
			assertThat(parser.parse("a: []").get("a").asList()).isEmpty();
		}

		@Test
		void elementsMaySpanLines() {
			assertThat(parser.parse("a: [\n    1,\n    2\n]\nb: 3"))
					.isEqualTo(GuraObject.builder().put("a", ints(1, 2)).put("b", 3).build());
		}

		@Test
		void objectsAsElements() {
			GuraObject parsed = parser.parse("people: [\n    name: \"Ana\"\n    age: 30,\n    name: \"Leo\"\n    age: 41\n]\n"
					+ "count: 2");

			assertThat(parsed).isEqualTo(GuraObject.builder()
					.put("people", GuraArray.of(
							GuraObject.builder().put("name", "Ana").put("age", 30).build(),
							GuraObject.builder().put("name", "Leo").put("age", 41).build()))
					.put("count", 2)
					.build());
		}

		@Test
		void unclosedArrayReportsTheNextLine() {
			assertThatThrownBy(() -> parser.parse("a: [1, 2\nb: 3"))
					.isInstanceOfSatisfying(GuraParseException.class, e -> {
						assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX);
						assertThat(e.position()).isEqualTo(9);
						assertThat(e.line()).isEqualTo(2);
					})
					.hasMessage("Expected ']' but got 'b'");
		}
	}

	@Nested
	@DisplayName("Objects and indentation")
	class ObjectsAndIndentation {

		@Test
		void dedentedPairBelongsToTheParent() {
			assertThat(parser.parse("a:\n    b: 1\nc: 2")).isEqualTo(GuraObject.builder()
					.put("a", GuraObject.builder().put("b", 1).build())
					.put("c", 2)
					.build());
		}

		@Test
		void threeLevels() {
			GuraObject parsed = parser.parse("a:\n    b:\n        c: true\n    d: 1");

			assertThat(parsed.get("a").asObject().get("b").asObject().get("c").asBoolean()).isTrue();
			assertThat(parsed.get("a").asObject().get("d").asLong()).isEqualTo(1);
		}

		@Test
		void emptyKeyword() {
			assertThat(parser.parse("a: empty\nb: 1").get("a")).isEqualTo(GuraObject.empty());
		}

		@Test
		void duplicatedKey() {
			assertFailure("a: 1\na: 2", ErrorKind.DUPLICATED_KEY, 5, 2);
		}

		@Test
		void indentationNotMultipleOfFour() {
			assertFailure("a:\n   b: 1", ErrorKind.INVALID_INDENTATION, 6, 2);
		}

		@Test
		void indentationNotMultipleOfFourWhenNested() {
			assertThatThrownBy(() -> parser.parse("a:\n    b:\n         c: 1"))
					.isInstanceOfSatisfying(GuraParseException.class,
							e -> assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_INDENTATION));
		}

		@Test
		void tabsAreRejected() {
			assertFailure("a:\n\tb: 1", ErrorKind.INVALID_INDENTATION, 4, 2);
		}

		@Test
		void childOnTheParentLevel() {
			assertThatThrownBy(() -> parser.parse("a:\nb: 1"))
					.isInstanceOfSatisfying(GuraParseException.class, e -> {
						assertThat(e.kind()).isEqualTo(ErrorKind.INVALID_INDENTATION);
						assertThat(e.position()).isZero();
					})
					.hasMessage("Wrong level for parent with key a");
		}

		@Test
		void childTooDeep() {
			assertThatThrownBy(() -> parser.parse("a:\n        b: 1"))
					.isInstanceOf(GuraParseException.class)
					.hasMessage("Difference between different indentation levels must be 4");
		}

		@Test
		void indentedFirstPair() {
			assertFailure("    a: 1", ErrorKind.INVALID_INDENTATION, 4, 1);
		}

		@Test
		void invalidKeys() {
			for (String text : new String[] {"with.dot: 5", "\"with_quotes\": 5", "with-dashes: 5"}) {
				assertThatThrownBy(() -> parser.parse(text))
						.as(text)
						.isInstanceOfSatisfying(GuraParseException.class,
								e -> assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX));
			}
		}

		@Test
		void trailingGarbage() {
			assertThatThrownBy(() -> parser.parse("a: 1\n}"))
					.isInstanceOfSatisfying(GuraParseException.class, e -> {
						assertThat(e.position()).isEqualTo(5);
						assertThat(e.line()).isEqualTo(2);
					})
					.hasMessage("Expected end of string but got '}'");
		}
	}

	@Nested
	@DisplayName("Useless lines")
	class UselessLines {

		@Test
		void blankLinesAndCommentsAreIgnored() {
			assertThat(parser.parse("\n\n# comment\na: 1   \n\n    \nb: 2 # trailing\n# end"))
					.isEqualTo(GuraObject.builder().put("a", 1).put("b", 2).build());
		}

		@Test
		void crlfLineEndings() {
			assertThat(parser.parse("a: 1\r\nb:\r\n    c: 2\r\n"))
					.isEqualTo(GuraObject.builder()
							.put("a", 1)
							.put("b", GuraObject.builder().put("c", 2).build())
							.build());
		}

		@Test
		void emptyDocuments() {
			assertThat(parser.parse("")).isEqualTo(GuraObject.empty());
			assertThat(parser.parse("   \n  ")).isEqualTo(GuraObject.empty());
			assertThat(parser.parse("# nothing here")).isEqualTo(GuraObject.empty());
		}

		@Test
		void documentWithOnlyVariables() {
			assertThat(parser.parse("$unused_var: 5")).isEqualTo(GuraObject.empty());
		}

		@Test
		void commentEndingInCarriageReturnEndsTheLine() {
			assertThat(parser.parse("# c\ra: 1")).isEqualTo(GuraObject.builder().put("a", 1).build());
			assertFailure("# c\ra: 1\nb: @", ErrorKind.SYNTAX, 12, 3);
		}
	}

	@Nested
	@DisplayName("Variables")
	class Variables {

		private final GuraParser withEnvironment = new GuraParser(GuraParserConfig.builder()
				.environment(Map.of("APP_HOME", "/opt/app")::get)
				.build());

		@Test
		void variablesKeepTheirType() {
			GuraObject parsed = parser.parse("$a: 1\n$b: $a\n$ratio: 0.5\nv: $b\nr: $ratio");

			assertThat(parsed.get("v")).isEqualTo(new GuraInteger(1));
			assertThat(parsed.get("r")).isEqualTo(new GuraFloat(0.5));
		}

		@Test
		void definedBeforeUse() {
			assertThat(parser.parse("$x: 1\nuse: $x").get("use")).isEqualTo(new GuraInteger(1));
		}

		@Test
		void environmentFallback() {
			GuraObject parsed = withEnvironment.parse("home: $APP_HOME\nlog: \"$APP_HOME/log\"");

			assertThat(parsed.get("home").asString()).isEqualTo("/opt/app");
			assertThat(parsed.get("log").asString()).isEqualTo("/opt/app/log");
		}

		@Test
		void documentShadowsEnvironment() {
			assertThat(withEnvironment.parse("$APP_HOME: \"/srv\"\nhome: $APP_HOME").get("home").asString())
					.isEqualTo("/srv");
		}

		@Test
		void duplicatedVariable() {
			assertFailure("$x: 1\n$x: 2", ErrorKind.DUPLICATED_VARIABLE, 7, 2);
		}

		@Test
		void undefinedVariable() {
			assertThatThrownBy(() -> withEnvironment.parse("use: $nope"))
					.isInstanceOfSatisfying(GuraParseException.class, e -> {
						assertThat(e.kind()).isEqualTo(ErrorKind.VARIABLE_NOT_DEFINED);
						assertThat(e.position()).isEqualTo(5);
						assertThat(e.line()).isEqualTo(1);
					})
					.hasMessage("Variable 'nope' is not defined in Gura nor as environment variable");
		}

		@Test
		void booleansCannotBeStored() {
			assertThatThrownBy(() -> parser.parse("$flag: true\na: 1"))
					.isInstanceOfSatisfying(GuraParseException.class,
							e -> assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX));
		}

		@Test
		void integerBeyondSixtyFourBitsCannotBeStored() {
			assertThatThrownBy(() -> parser.parse("a: 1\n$x: 99999999999999999999\nb: 2"))
					.isInstanceOfSatisfying(GuraParseException.class, e -> {
						assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX);
						assertThat(e.position()).isEqualTo(29);
						assertThat(e.line()).isEqualTo(2);
					})
					.hasMessageStartingWith("Invalid variable value for 'x'");
		}

		@Test
		void interpolatedFloatsHaveNoExponent() {
			assertThat(parser.parse("$big: 1e20\ns: \"n=$big\"").get("s").asString())
					.isEqualTo("n=100000000000000000000");
		}
	}
}
