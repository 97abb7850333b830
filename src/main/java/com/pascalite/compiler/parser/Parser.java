package com.pascalite.compiler.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;

import com.pascalite.compiler.parser.Declaration.Block;
import com.pascalite.compiler.parser.Declaration.Item;
import com.pascalite.compiler.parser.Declaration.Program;
import com.pascalite.compiler.parser.Expr.Binary;
import com.pascalite.compiler.parser.Expr.BooleanLiteral;
import com.pascalite.compiler.parser.Expr.ExprInterface;
import com.pascalite.compiler.parser.Expr.IntegerLiteral;
import com.pascalite.compiler.parser.Expr.RealLiteral;
import com.pascalite.compiler.parser.Expr.StringLiteral;
import com.pascalite.compiler.parser.Expr.Unary;
import com.pascalite.compiler.parser.Expr.Variable;
import com.pascalite.compiler.parser.Statement.Compound;
import com.pascalite.compiler.parser.Statement.Stmt;
import com.pascalite.debug.Debug;

/**
 * Recursive-descent parser with one method per nonterminal.
 *
 * Every method asks the {@link Grammar} predict table which production the
 * current lookahead selects and then consumes exactly that production's
 * right-hand side. Tail nonterminals ({@code AddTail}, {@code MulTail}, ...)
 * are walked as loops so binary operators associate to the left.
 */
public class Parser {
    private static final String TAG = "pascalite.parser";

    private final Iterator<Token> tokens;
    private final Grammar grammar;
    private Token lookahead;

    public Parser(Lexer lexer) {
        this(lexer.iterator(), Grammar.PASCAL);
    }

    public Parser(Iterator<Token> tokens, Grammar grammar) {
        this.tokens = tokens;
        this.grammar = grammar;
        this.lookahead = tokens.next();
    }

    /** Parses the whole input; the program must be followed by end of input. */
    public Program parse() {
        select(Nonterminal.PROGRAM);
        Token name = programHeading();
        Block block = block();
        consume(TokenType.DOT);
        consume(TokenType.EOF);
        Debug.get().d(TAG, "parsed program " + (name == null ? "<unnamed>" : name.lexeme));
        return new Program(name, block);
    }

    private Token programHeading() {
        if (select(Nonterminal.PROGRAM_HEADING) == Production.PROGRAM_HEADING_EMPTY) return null;
        consume(TokenType.PROGRAM);
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.SEMICOLON);
        return name;
    }

    private Block block() {
        select(Nonterminal.BLOCK);
        List<Item> declarations = new ArrayList<>();
        while (select(Nonterminal.DECLARATIONS) == Production.DECLARATIONS) {
            declaration(declarations);
        }
        Compound body = compoundStatement();
        return new Block(declarations, body);
    }

    private void declaration(List<Item> out) {
        switch (select(Nonterminal.DECLARATION)) {
            case DECLARATION_CONST:
                constSection(out);
                break;
            case DECLARATION_VAR:
                varSection(out);
                break;
            case DECLARATION_PROCEDURE:
                out.add(procedureDeclaration());
                break;
            default:
                throw unreachable(Nonterminal.DECLARATION);
        }
    }

    private void constSection(List<Item> out) {
        select(Nonterminal.CONST_SECTION);
        consume(TokenType.CONST);
        out.add(constDefinition());
        while (select(Nonterminal.CONST_DEFINITIONS) == Production.CONST_DEFINITIONS) {
            out.add(constDefinition());
        }
    }

    private Declaration.Constant constDefinition() {
        select(Nonterminal.CONST_DEFINITION);
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.EQUAL);
        ExprInterface value = constant();
        consume(TokenType.SEMICOLON);
        return new Declaration.Constant(name, value);
    }

    private ExprInterface constant() {
        switch (select(Nonterminal.CONSTANT)) {
            case CONSTANT_SIGNED: {
                Token sign = sign();
                return new Unary(sign, unsignedNumber());
            }
            case CONSTANT_UNSIGNED:
                return unsignedNumber();
            case CONSTANT_STRING:
                return new StringLiteral(advance());
            case CONSTANT_TRUE:
            case CONSTANT_FALSE:
                return new BooleanLiteral(advance());
            default:
                throw unreachable(Nonterminal.CONSTANT);
        }
    }

    private void varSection(List<Item> out) {
        select(Nonterminal.VAR_SECTION);
        consume(TokenType.VAR);
        out.add(varDeclaration());
        while (select(Nonterminal.VAR_DECLARATIONS) == Production.VAR_DECLARATIONS) {
            out.add(varDeclaration());
        }
    }

    private Declaration.Variables varDeclaration() {
        select(Nonterminal.VAR_DECLARATION);
        List<Token> names = identifierList();
        consume(TokenType.COLON);
        Token type = type();
        consume(TokenType.SEMICOLON);
        return new Declaration.Variables(names, type);
    }

    private List<Token> identifierList() {
        select(Nonterminal.IDENTIFIER_LIST);
        List<Token> names = new ArrayList<>();
        names.add(consume(TokenType.IDENTIFIER));
        while (select(Nonterminal.IDENTIFIER_LIST_TAIL) == Production.IDENTIFIER_LIST_TAIL) {
            consume(TokenType.COMMA);
            names.add(consume(TokenType.IDENTIFIER));
        }
        return names;
    }

    private Token type() {
        select(Nonterminal.TYPE);
        return advance();
    }

    private Declaration.Procedure procedureDeclaration() {
        select(Nonterminal.PROCEDURE_DECLARATION);
        consume(TokenType.PROCEDURE);
        Token name = consume(TokenType.IDENTIFIER);
        consume(TokenType.SEMICOLON);
        Block body = block();
        consume(TokenType.SEMICOLON);
        return new Declaration.Procedure(name, body);
    }

    private Compound compoundStatement() {
        select(Nonterminal.COMPOUND_STATEMENT);
        Token begin = consume(TokenType.BEGIN);
        List<Stmt> statements = statementList();
        consume(TokenType.END);
        return new Compound(begin, statements);
    }

    private List<Stmt> statementList() {
        select(Nonterminal.STATEMENT_LIST);
        List<Stmt> statements = new ArrayList<>();
        statements.add(statement());
        while (select(Nonterminal.STATEMENT_LIST_TAIL) == Production.STATEMENT_LIST_TAIL) {
            consume(TokenType.SEMICOLON);
            statements.add(statement());
        }
        return statements;
    }

    private Stmt statement() {
        switch (select(Nonterminal.STATEMENT)) {
            case STATEMENT_IDENT:
                return identStatement(consume(TokenType.IDENTIFIER));
            case STATEMENT_COMPOUND:
                return compoundStatement();
            case STATEMENT_IF:
                return ifStatement();
            case STATEMENT_WHILE: {
                Token keyword = consume(TokenType.WHILE);
                ExprInterface condition = expression();
                consume(TokenType.DO);
                return new Statement.While(keyword, condition, statement());
            }
            case STATEMENT_REPEAT: {
                Token keyword = consume(TokenType.REPEAT);
                List<Stmt> body = statementList();
                consume(TokenType.UNTIL);
                return new Statement.Repeat(keyword, body, expression());
            }
            case STATEMENT_FOR:
                return forStatement();
            case STATEMENT_EMPTY:
                return new Statement.Empty(lookahead.position);
            default:
                throw unreachable(Nonterminal.STATEMENT);
        }
    }

    private Stmt identStatement(Token name) {
        switch (select(Nonterminal.IDENT_STATEMENT_TAIL)) {
            case IDENT_STATEMENT_ASSIGN: {
                Token operator = consume(TokenType.ASSIGN);
                return new Statement.Assign(new Variable(name), operator, expression());
            }
            case IDENT_STATEMENT_CALL_ARGS: {
                consume(TokenType.LEFT_PAREN);
                List<ExprInterface> arguments = expressionList();
                consume(TokenType.RIGHT_PAREN);
                return new Statement.Call(name, arguments);
            }
            case IDENT_STATEMENT_CALL:
                return new Statement.Call(name, new ArrayList<>());
            default:
                throw unreachable(Nonterminal.IDENT_STATEMENT_TAIL);
        }
    }

    private Stmt ifStatement() {
        Token keyword = consume(TokenType.IF);
        ExprInterface condition = expression();
        consume(TokenType.THEN);
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (select(Nonterminal.ELSE_PART) == Production.ELSE_PART) {
            consume(TokenType.ELSE);
            elseBranch = statement();
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    private Stmt forStatement() {
        Token keyword = consume(TokenType.FOR);
        Variable variable = new Variable(consume(TokenType.IDENTIFIER));
        consume(TokenType.ASSIGN);
        ExprInterface from = expression();
        boolean downTo = select(Nonterminal.DIRECTION) == Production.DIRECTION_DOWNTO;
        advance();
        ExprInterface to = expression();
        consume(TokenType.DO);
        return new Statement.For(keyword, variable, from, downTo, to, statement());
    }

    private List<ExprInterface> expressionList() {
        select(Nonterminal.EXPRESSION_LIST);
        List<ExprInterface> expressions = new ArrayList<>();
        expressions.add(expression());
        while (select(Nonterminal.EXPRESSION_LIST_TAIL) == Production.EXPRESSION_LIST_TAIL) {
            consume(TokenType.COMMA);
            expressions.add(expression());
        }
        return expressions;
    }

    private ExprInterface expression() {
        select(Nonterminal.EXPRESSION);
        ExprInterface expr = simpleExpression();
        if (select(Nonterminal.RELATION_TAIL) == Production.RELATION_TAIL) {
            select(Nonterminal.RELATIONAL_OPERATOR);
            Token op = advance();
            ExprInterface right = simpleExpression();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface simpleExpression() {
        ExprInterface expr;
        if (select(Nonterminal.SIMPLE_EXPRESSION) == Production.SIMPLE_EXPRESSION_SIGNED) {
            Token sign = sign();
            expr = new Unary(sign, term());
        } else {
            expr = term();
        }
        while (select(Nonterminal.ADD_TAIL) == Production.ADD_TAIL) {
            select(Nonterminal.ADDING_OPERATOR);
            Token op = advance();
            ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface term() {
        select(Nonterminal.TERM);
        ExprInterface expr = factor();
        while (select(Nonterminal.MUL_TAIL) == Production.MUL_TAIL) {
            select(Nonterminal.MULTIPLYING_OPERATOR);
            Token op = advance();
            ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprInterface factor() {
        switch (select(Nonterminal.FACTOR)) {
            case FACTOR_VARIABLE:
                return new Variable(advance());
            case FACTOR_INTEGER:
                return new IntegerLiteral(advance());
            case FACTOR_REAL:
                return new RealLiteral(advance());
            case FACTOR_STRING:
                return new StringLiteral(advance());
            case FACTOR_TRUE:
            case FACTOR_FALSE:
                return new BooleanLiteral(advance());
            case FACTOR_PARENTHESIZED: {
                consume(TokenType.LEFT_PAREN);
                ExprInterface inner = expression();
                consume(TokenType.RIGHT_PAREN);
                return inner;
            }
            case FACTOR_NOT: {
                Token op = advance();
                return new Unary(op, factor());
            }
            default:
                throw unreachable(Nonterminal.FACTOR);
        }
    }

    private Token sign() {
        select(Nonterminal.SIGN);
        return advance();
    }

    private ExprInterface unsignedNumber() {
        if (select(Nonterminal.UNSIGNED_NUMBER) == Production.UNSIGNED_REAL) {
            return new RealLiteral(advance());
        }
        return new IntegerLiteral(advance());
    }

    /** Picks the production for {@code nonterminal} from the current lookahead, without consuming it. */
    private Production select(Nonterminal nonterminal) {
        Production p = grammar.predict(nonterminal, lookahead.type);
        if (p == null) throw new SyntaxException(grammar.expected(nonterminal), lookahead);
        return p;
    }

    private Token consume(TokenType type) {
        if (lookahead.type == type) return advance();
        throw new SyntaxException(EnumSet.of(type), lookahead);
    }

    private Token advance() {
        Token consumed = lookahead;
        if (consumed.type != TokenType.EOF) lookahead = tokens.next();
        return consumed;
    }

    private IllegalStateException unreachable(Nonterminal nonterminal) {
        return new IllegalStateException("predict table returned a foreign production for " + nonterminal);
    }
}
