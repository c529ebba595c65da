package com.example.flowbridge.script;

import com.example.flowbridge.errors.FlowErrorCode;
import com.example.flowbridge.errors.ScriptParseException;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PythonParser")
class PythonParserTest {

    @Nested
    @DisplayName("lexer")
    class Lexer {

        private List<Integer> tokenTypes(String source) {
            PythonScriptLexer lexer = new PythonScriptLexer(CharStreams.fromString(source));
            CommonTokenStream stream = new CommonTokenStream(lexer);
            stream.fill();
            return stream.getTokens().stream().map(Token::getType).toList();
        }

        @Test
        @DisplayName("emits INDENT and DEDENT around an indented block")
        void indentAndDedent() {
            List<Integer> types = tokenTypes("if x:\n    y = 1\nz = 2\n");
            assertThat(types).contains(PythonScriptLexer.INDENT, PythonScriptLexer.DEDENT);
            assertThat(types.indexOf(PythonScriptLexer.INDENT)).isLessThan(types.indexOf(PythonScriptLexer.DEDENT));
            assertEquals(Token.EOF, types.get(types.size() - 1));
        }

        @Test
        @DisplayName("ignores newlines inside brackets")
        void bracketsJoinLines() {
            List<Integer> types = tokenTypes("x = [\n  1,\n  2,\n]\n");
            assertEquals(1, types.stream().filter(t -> t == PythonScriptLexer.NEWLINE).count());
        }

        @Test
        @DisplayName("skips blank and comment lines without ending the block")
        void blankAndCommentLines() {
            List<Integer> types = tokenTypes("if x:\n    y = 1\n\n    # note\n    z = 2\n");
            assertEquals(1, types.stream().filter(t -> t == PythonScriptLexer.INDENT).count());
            assertEquals(1, types.stream().filter(t -> t == PythonScriptLexer.DEDENT).count());
            assertEquals(3, types.stream().filter(t -> t == PythonScriptLexer.NEWLINE).count());
        }

        @Test
        @DisplayName("closes open blocks when the source lacks a final newline")
        void missingFinalNewline() {
            List<Integer> types = tokenTypes("def f():\n    return 1");
            assertEquals(List.of(PythonScriptLexer.NEWLINE, PythonScriptLexer.DEDENT, Token.EOF),
                    types.subList(types.size() - 3, types.size()));
        }
    }

    @Nested
    @DisplayName("string literals")
    class StringLiteralValues {

        private Expr valueOf(String source) {
            Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, PythonParser.parse(source).body().get(0));
            return assign.value();
        }

        @Test
        @DisplayName("decodes escapes in an f-string and keeps its template")
        void formattedString() {
            Expr.FStr value = assertInstanceOf(Expr.FStr.class, valueOf("x = f'a\\tb{name}'\n"));
            assertEquals("a\tb{name}", value.template());
            assertTrue(value.interpolated());
        }

        @Test
        @DisplayName("keeps backslashes in raw strings")
        void rawString() {
            assertEquals(new Expr.Str("a\\d+"), valueOf("x = r'a\\d+'\n"));
        }

        @Test
        @DisplayName("reads triple-quoted strings across lines")
        void tripleQuoted() {
            assertEquals(new Expr.Str("one\ntwo"), valueOf("x = \"\"\"one\ntwo\"\"\"\n"));
        }

        @Test
        @DisplayName("escapes braces of plain parts joined to an f-string")
        void mixedConcatenation() {
            Expr.FStr value = assertInstanceOf(Expr.FStr.class, valueOf("x = '{a}' f'{b}'\n"));
            assertEquals("{{a}}{b}", value.template());
        }

        @Test
        @DisplayName("rejects bytes joined to text")
        void bytesAndText() {
            ScriptParseException ex = assertThrows(ScriptParseException.class, () -> valueOf("x = b'a' 'b'\n"));
            assertEquals(1, ex.getLine());
        }
    }

    @Nested
    @DisplayName("statements")
    class Statements {

        @Test
        @DisplayName("concatenates adjacent string literals")
        void adjacentStrings() {
            ScriptModule module = PythonParser.parse("x = (\n    \"ab\"\n    'cd'\n)\n");
            Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
            assertEquals(new Expr.Str("abcd"), assign.value());
        }

        @Test
        @DisplayName("parses a decorated async function with annotations")
        void decoratedFunction() {
            String source = """
                    @function_tool
                    async def compute(a: int, b: int = 2, *rest, **extra) -> int:
                        return a + b
                    """;
            Stmt.FunctionDef function = assertInstanceOf(Stmt.FunctionDef.class, PythonParser.parse(source).body().get(0));
            assertEquals("compute", function.name());
            assertTrue(function.async());
            assertEquals(1, function.decorators().size());
            assertEquals(new Expr.Name("int"), function.returns());
            assertEquals(4, function.params().size());
            assertEquals(Param.Kind.VAR_POSITIONAL, function.params().get(2).kind());
            assertEquals(Param.Kind.VAR_KEYWORD, function.params().get(3).kind());
            assertNotNull(function.params().get(1).defaultValue());
        }

        @Test
        @DisplayName("chains elif clauses and keeps the final else")
        void ifElifElse() {
            String source = """
                    if x == "a":
                        pass
                    elif x == "b":
                        pass
                    else:
                        y = 1
                    """;
            Stmt.If first = assertInstanceOf(Stmt.If.class, PythonParser.parse(source).body().get(0));
            Stmt.If second = first.elifClause();
            assertNotNull(second);
            assertNull(second.elifClause());
            assertEquals(1, second.orElse().size());
            assertInstanceOf(Stmt.Assign.class, second.orElse().get(0));
        }

        @Test
        @DisplayName("parses a model class with annotated fields")
        void classWithFields() {
            String source = """
                    class Extraction(BaseModel):
                        title: str
                        tags: list[str]  # free-form labels
                    """;
            Stmt.ClassDef classDef = assertInstanceOf(Stmt.ClassDef.class, PythonParser.parse(source).body().get(0));
            assertEquals("Extraction", classDef.name());
            assertEquals(List.of(new Expr.Name("BaseModel")), classDef.bases());
            assertEquals(2, classDef.body().size());
            Stmt.AnnAssign tags = assertInstanceOf(Stmt.AnnAssign.class, classDef.body().get(1));
            assertInstanceOf(Expr.Subscript.class, tags.annotation());
        }

        @Test
        @DisplayName("accepts trailing commas in calls and collections")
        void trailingCommas() {
            ScriptModule module = PythonParser.parse("agent = Agent(name=\"A\", tools=[a, b,],)\n");
            Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
            Expr.Call call = assertInstanceOf(Expr.Call.class, assign.value());
            assertEquals(2, call.keywords().size());
            Expr.ListExpr tools = assertInstanceOf(Expr.ListExpr.class, call.keyword("tools"));
            assertEquals(2, tools.elements().size());
        }

        @Test
        @DisplayName("parses await, starred list elements and comprehensions")
        void awaitAndComprehension() {
            String source = """
                    async def run():
                        r = await Runner.run(agent, input=[*history])
                        history.extend([item.to_input_item() for item in r.new_items])
                    """;
            Stmt.FunctionDef function = assertInstanceOf(Stmt.FunctionDef.class, PythonParser.parse(source).body().get(0));
            Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, function.body().get(0));
            Expr.Call call = assertInstanceOf(Expr.Call.class, assertInstanceOf(Expr.Await.class, assign.value()).value());
            Expr.ListExpr input = assertInstanceOf(Expr.ListExpr.class, call.keyword("input"));
            assertInstanceOf(Expr.Starred.class, input.elements().get(0));
            Stmt.ExprStmt extend = assertInstanceOf(Stmt.ExprStmt.class, function.body().get(1));
            Expr.Call extendCall = assertInstanceOf(Expr.Call.class, extend.value());
            assertInstanceOf(Expr.ListComp.class, extendCall.args().get(0));
        }
    }

    @Nested
    @DisplayName("syntax errors")
    class SyntaxErrors {

        @Test
        @DisplayName("reports an unterminated string with its line")
        void unterminatedString() {
            ScriptParseException ex = assertThrows(ScriptParseException.class,
                    () -> PythonParser.parse("x = 1\ny = 'abc\n"));
            assertEquals(FlowErrorCode.PARSE_ERROR, ex.getCode());
            assertEquals(2, ex.getLine());
            assertThat(ex.getMessage()).contains("line 2");
            assertEquals(2, ex.getDetails().get("line"));
        }

        @Test
        @DisplayName("reports an unmatched closing bracket")
        void unmatchedBracket() {
            ScriptParseException ex = assertThrows(ScriptParseException.class, () -> PythonParser.parse("x = 1)\n"));
            assertEquals(1, ex.getLine());
        }

        @Test
        @DisplayName("reports an inconsistent dedent")
        void badDedent() {
            ScriptParseException ex = assertThrows(ScriptParseException.class,
                    () -> PythonParser.parse("if x:\n        y = 1\n    z = 2\n"));
            assertEquals(3, ex.getLine());
        }
    }
}
