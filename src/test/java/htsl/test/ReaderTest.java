// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package htsl.test;

import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.util.stream.Stream;
import htsl.sexp.Sexp;
import htsl.sexp.Sexps;
import htsl.sexp.SymbolTable;
import htsl.sexp.reader.ByteStream;
import htsl.sexp.reader.ReadErrorCondition;
import htsl.sexp.reader.Reader;
import htsl.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

final class ReaderTest {
    static Stream<Arguments> provideForms() {
        return Stream.of(
            Arguments.of("(a b c)", "(a b c)"),
            Arguments.of("(a . b)", "(a . b)"),
            Arguments.of("(a . \"b\")", "(a . \"b\")"),
            Arguments.of("(a . (b c))", "(a b c)"),
            Arguments.of("(a . nil)", "(a)"),
            Arguments.of("(a . ())", "(a)"),
            Arguments.of("( a  .  7 )", "(a . 7)"),
            Arguments.of("(a.b)", "(a.b)"),
            Arguments.of("(a .b)", "(a .b)"),
            Arguments.of("()", "()"),
            Arguments.of("(() ())", "(() ())"),
            Arguments.of("((a . b) (c))", "((a . b) (c))"),
            Arguments.of("\"a\\\"b\\\\c\"", "\"a\\\"b\\\\c\""),
            Arguments.of("\"Ä\"", "\"Ä\""),
            Arguments.of("; comment\n(a) ; trailing", "(a)")
        );
    }

    static Stream<Arguments> provideMalformedSources() {
        return Stream.of(
            Arguments.of("(a", "Expected closing ')' but found end of input instead"),
            Arguments.of("\"abc", "Expected closing '\"' but found end of input instead"),
            Arguments.of(")", "Expected a form, but found ')' instead"),
            Arguments.of(".", "Unexpected '.' outside of a list"),
            Arguments.of("(. a)", "Expected a form before '.'"),
            Arguments.of("(a . )", "Expected a form, but found ')' instead"),
            Arguments.of("(a . b c)", "Expected ')' after the form following '.'"),
            Arguments.of("(a . . b)", "Expected a form after '.', but found another '.'"),
            Arguments.of("(a b . c)", "Dotted lists with more than one element before '.' are unsupported"),
            Arguments.of("'a", "Reserved character ''' found"),
            Arguments.of("#x", "Reserved character '#' found"),
            Arguments.of("(a |b)", "Reserved character '|' found")
        );
    }

    @ParameterizedTest
    @MethodSource("provideForms")
    void readsForms(final String source, final String printed) {
        assertThat(Sexps.print(TestSexps.read(source))).isEqualTo(printed);
    }

    @ParameterizedTest
    @CsvSource({
        "17, 17",
        "-17, -17",
        "+5, 5",
        "007, 7",
        "123456789012345678901234567890, 123456789012345678901234567890",
    })
    void readsIntegers(final String source, final String value) {
        assertThat(TestSexps.read(source)).isEqualTo(new Sexp.Integer(new BigInteger(value)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-", "+", "1a", "-x", "+-1", "a1", "1.5"})
    void readsNumberLikeSymbols(final String source) {
        final var form = TestSexps.read(source);
        assertThat(form).isInstanceOf(Sexp.Symbol.class);
        assertThat(((Sexp.Symbol) form).symbolName()).isEqualTo(source);
    }

    @Test
    void readsStringEscapes() {
        assertThat(Sexps.asString(TestSexps.read("\"a\\\"b\\\\c\\d\""))).isEqualTo("a\"b\\cd");
        assertThat(Sexps.asString(TestSexps.read("\"multi\nline\""))).isEqualTo("multi\nline");
    }

    @Test
    void internsSymbols() {
        final var symbolTable = new SymbolTable();
        final var forms = new Reader(ByteStream.ofString("(foo foo nil @ @H @@@@)"), symbolTable).readAll();
        final var elements = Sexps.asList(forms.get(0));
        assertThat(elements).isNotNull();
        assertThat(elements.get(0)).isSameAs(elements.get(1)).isSameAs(symbolTable.intern("foo"));
        assertThat(elements.get(2)).isSameAs(Sexp.KnownSymbol.NIL);
        assertThat(elements.get(3)).isSameAs(Sexp.KnownSymbol.ATTRIBUTES);
        assertThat(elements.get(4)).isSameAs(Sexp.KnownSymbol.NO_ESCAPE);
        assertThat(elements.get(5)).isSameAs(Sexp.KnownSymbol.DOCTYPE);
    }

    @Test
    void returnsNullAtEndOfInput() {
        final var reader = new Reader(ByteStream.ofString(" (a) ; nothing else\n  "), new SymbolTable());
        assertThat(reader.readTopLevelForm()).isNotNull();
        assertThat(reader.readTopLevelForm()).isNull();
        assertThat(reader.readTopLevelForm()).isNull();
        assertThat(TestSexps.readAll("")).isEmpty();
    }

    @ParameterizedTest
    @MethodSource("provideMalformedSources")
    void signalsReadErrors(final String source, final String message) {
        final var condition = FatalConditions.capture(() -> TestSexps.readAll(source));
        assertThat(condition).isInstanceOf(ReadErrorCondition.class);
        assertThat(condition.message()).isEqualTo(message);
    }

    @Test
    void reportsErrorLine() {
        final var condition = FatalConditions.capture(() -> TestSexps.readAll("(a)\n\n(b\n  'c)"));
        assertThat(condition).isInstanceOf(ReadErrorCondition.class);
        assertThat(((ReadErrorCondition) condition).lineNumber()).isEqualTo(4);
        assertThat(condition.detailedMessage()).contains("line 4").contains("line 3");
    }

    @Test
    void limitsNesting() {
        final var condition = FatalConditions.capture(() -> TestSexps.readAll("(".repeat(200)));
        assertThat(condition.message()).startsWith("Recursion limit reached");
    }

    @Test
    void rejectsInvalidUtf8() {
        final var bytes = new byte[]{'"', (byte) 0xC3, '"'};
        final var reader = new Reader(new ByteStream(new ByteArrayInputStream(bytes)), new SymbolTable());
        final var condition = FatalConditions.capture(reader::readAll);
        assertThat(condition.message()).isEqualTo("Invalid UTF-8 byte sequence detected");
    }

    @Test
    void unhandledReadErrorsThrow() {
        assertThatThrownBy(() -> TestSexps.readAll("(a"))
            .isInstanceOf(UnhandledErrorError.class)
            .satisfies(e -> assertThat(((UnhandledErrorError) e).condition()).isInstanceOf(ReadErrorCondition.class));
    }
}
