package com.qmigrate.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.qmigrate.debug.Debug;
import com.qmigrate.script.parser.Statement.Conditional;
import com.qmigrate.script.parser.Statement.Include;
import com.qmigrate.script.parser.Statement.Load;
import com.qmigrate.script.parser.Statement.Option;
import com.qmigrate.script.parser.Statement.Stmt;
import com.qmigrate.script.parser.Statement.VarOp;

/**
 * Recursive descent parser for normalized qmake project text.
 *
 * <pre>
 * file        := group EOF
 * group       := { EOL | statement (EOL | &amp;'}') | scope | elseBranch }
 * statement   := load(args) | include(args) | option(args) | key op values
 *              | defineTest(args) {..} | defineReplace(args) {..} | for(args) ({..} | ':' ...)
 *              | name(args)
 * scope       := condition ( block | ':' (block | statement) | '|' name(args) )
 * condition   := atom { (':' | '|') atom }
 * elseBranch  := 'else' ( block | ':' (block | statement | scope) )
 * </pre>
 *
 * Function and loop definitions, and bare function calls, are consumed and
 * discarded.
 */
public class Parser {
    private static final String TAG = "qmigrate.parser";

    /** Marks a statement that was recognized but has no effect on variables. */
    private static final Stmt DISCARDED = visitor -> { };

    private static final Set<String> BLOCK_DEFINITIONS = Set.of("defineTest", "defineReplace", "for");

    private final Lexer lexer;

    public Parser(String source) {
        this.lexer = new Lexer(source);
    }

    public List<Stmt> parse() {
        List<Stmt> statements = group(false);
        Debug.get().t(TAG, "Parsed " + statements.size() + " top-level statements");
        return statements;
    }

    private List<Stmt> group(boolean inBlock) {
        List<Stmt> statements = new ArrayList<>();
        while (true) {
            lexer.skipBlanks();
            if (lexer.isAtEnd()) {
                if (inBlock) throw lexer.error("Expect '}' after block.");
                return statements;
            }

            char c = lexer.peek();
            if (c == '\n') {
                lexer.advance();
                continue;
            }
            if (c == '}') {
                if (inBlock) return statements;
                throw lexer.error("Unexpected '}'.");
            }
            if (lexer.checkKeyword("else")) {
                elseBranch(statements);
                continue;
            }

            Stmt stmt = statement();
            if (stmt == null) {
                stmt = scope();
            } else {
                endStatement();
            }
            if (stmt != DISCARDED) statements.add(stmt);
        }
    }

    /**
     * Tries to read a plain statement at the current position. Returns null and
     * leaves the position untouched when the text is a condition instead.
     * The statement terminator is left for the caller.
     */
    private Stmt statement() {
        if (!Lexer.isIdentifierStart(lexer.peek())) return null;

        long mark = lexer.mark();
        Token name = lexer.identifier();
        lexer.skipBlanks();

        Token op = lexer.operator();
        if (op != null) {
            return new VarOp(name.lexeme, (OpKind) op.literal, values());
        }

        if (lexer.peek() == '(') {
            Token args = lexer.callArgs();
            if (lexer.atStatementEnd()) {
                return call(name, args);
            }
            if (BLOCK_DEFINITIONS.contains(name.lexeme) && lexer.peek() == '{') {
                lexer.skipBracedBody();
                return DISCARDED;
            }
            if (name.lexeme.equals("for") && lexer.peek() == ':') {
                lexer.skipToLineEnd();
                return DISCARDED;
            }
        }

        lexer.reset(mark);
        return null;
    }

    private Stmt call(Token name, Token args) {
        String argument = unquote(args.text());
        switch (name.lexeme) {
            case "include":
                return new Include(argument);
            case "load":
                return new Load(argument);
            case "option":
                return new Option(argument);
            default:
                Debug.get().t(TAG, "Ignoring call " + name.lexeme + args.lexeme + " at line " + name.line);
                return DISCARDED;
        }
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private List<String> values() {
        List<String> values = new ArrayList<>();
        while (!lexer.atValueEnd()) {
            char c = lexer.peek();
            if (c == '"') {
                values.add(lexer.quoted().text());
            } else if (lexer.checkFunctionValue()) {
                values.add(lexer.functionValue().text());
            } else if (c == '(') {
                values.addAll(Lexer.items(lexer.bracedValue()));
            } else {
                values.add(lexer.valueRun().text());
            }
        }
        return values;
    }

    private void endStatement() {
        if (!lexer.atStatementEnd()) {
            throw lexer.error("Unexpected '" + lexer.peek() + "' at end of statement.");
        }
        lexer.match('\n');
    }

    private Conditional scope() {
        String condition = condition();

        List<Stmt> body;
        char c = lexer.peek();
        if (c == '{') {
            body = block();
        } else if (c == ':') {
            lexer.advance();
            lexer.skipBlanks();
            body = lexer.peek() == '{' ? block() : singleStatement("Expect statement after ':'.");
        } else if (c == '|') {
            // "write_file(...)|error(...)": the alternative is a call, there is no body
            lexer.advance();
            lexer.skipBlanks();
            if (statement() == null) throw lexer.error("Expect function call after '|'.");
            endStatement();
            body = new ArrayList<>();
        } else {
            throw lexer.error("Expect '{' or ':' after condition.");
        }
        return new Conditional(condition, body, null);
    }

    /** Condition atoms joined by "&&" (for ':') and "|" (for '|'), still in qmake syntax. */
    private String condition() {
        StringBuilder condition = new StringBuilder(lexer.conditionAtom().text());
        while (true) {
            lexer.skipBlanks();
            char c = lexer.peek();
            if (c != ':' && c != '|') break;
            int atomStart = lexer.skipSpacesFrom(lexer.position() + 1);
            if (lexer.conditionAtomEnd(atomStart) < 0) break;

            lexer.advance();
            lexer.skipBlanks();
            condition.append(c == ':' ? " && " : " | ").append(lexer.conditionAtom().text());
        }
        return condition.toString();
    }

    private List<Stmt> block() {
        lexer.consume('{', "Expect '{' before block.");
        List<Stmt> statements = group(true);
        lexer.consume('}', "Expect '}' after block.");
        return statements;
    }

    private List<Stmt> singleStatement(String message) {
        Stmt stmt = statement();
        if (stmt == null) throw lexer.error(message);
        endStatement();
        List<Stmt> out = new ArrayList<>();
        if (stmt != DISCARDED) out.add(stmt);
        return out;
    }

    private void elseBranch(List<Stmt> statements) {
        int elseLine = lexer.line();
        int elseColumn = lexer.column();
        lexer.keyword("else");
        lexer.skipBlanks();

        List<Stmt> body;
        if (lexer.peek() == '{') {
            body = block();
        } else if (lexer.match(':')) {
            lexer.skipBlanks();
            if (lexer.peek() == '{') {
                body = block();
            } else {
                Stmt stmt = statement();
                if (stmt == null) {
                    stmt = scope();
                } else {
                    endStatement();
                }
                body = new ArrayList<>();
                if (stmt != DISCARDED) body.add(stmt);
            }
        } else {
            throw lexer.error("Expect '{' or ':' after 'else'.");
        }

        int last = statements.size() - 1;
        if (last >= 0 && statements.get(last) instanceof Conditional) {
            Conditional attached = attachElse((Conditional) statements.get(last), body);
            if (attached == null) {
                throw new ParseError(elseLine, elseColumn, "'else' after a chain that already ended in 'else'.");
            }
            statements.set(last, attached);
            return;
        }
        // Left for scope construction to reject when nothing precedes it.
        statements.add(new Conditional("else", body, null));
    }

    /**
     * Attaches an else body to the innermost open branch of an if/else chain
     * ("a {..} else: b {..} else {..}"), or returns null when the chain is closed.
     */
    private static Conditional attachElse(Conditional conditional, List<Stmt> elseBody) {
        if (conditional.elseBody == null) {
            return conditional.withElse(elseBody);
        }
        List<Stmt> current = conditional.elseBody;
        if (current.size() == 1 && current.get(0) instanceof Conditional) {
            Conditional nested = attachElse((Conditional) current.get(0), elseBody);
            if (nested == null) return null;
            List<Stmt> replaced = new ArrayList<>();
            replaced.add(nested);
            return conditional.withElse(replaced);
        }
        return null;
    }
}
