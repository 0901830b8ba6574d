package com.rift.parser;

import com.rift.exception.AllocationException;
import com.rift.exception.ParseException;
import com.rift.lexer.Token;
import com.rift.lexer.TokenCategory;
import com.rift.lexer.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Stage 1: recursive descent parser producing a binary expression tree.
 * <p>
 * Grammar (binary operators are left-associative):
 * <pre>
 * expression := term (ADDITIVE term)*
 * term       := factor (MULTIPLICATIVE factor)*
 * factor     := IDENTIFIER | NUMBER
 * </pre>
 * The whole stream must form one expression. Trees deeper than {@link #MAX_DEPTH}
 * are rejected with an {@link AllocationException}, since every later stage walks
 * the tree recursively.
 */
public final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    public static final int MAX_DEPTH = 1000;

    private final OperatorTiers tiers;

    public Parser() {
        this(OperatorTiers.arithmetic());
    }

    public Parser(OperatorTiers tiers) {
        this.tiers = tiers;
        log.info("Parser initialized: additive={}, multiplicative={}",
                tiers.additive(), tiers.multiplicative());
    }

    /**
     * Parse a token stream into an AST.
     *
     * @throws ParseException on the first syntax error; no recovery is attempted
     * @throws AllocationException if the tree would be deeper than {@link #MAX_DEPTH}
     */
    public AstNode parse(TokenStream tokens) {
        Cursor cursor = new Cursor(tokens);
        AstNode root = parseExpression(cursor).node();

        Optional<Token> trailing = cursor.current();
        if (trailing.isPresent()) {
            throw cursor.unexpected(trailing.get(), "expected end of input");
        }

        log.debug("Parsing complete: root {}", root.getType());
        return root;
    }

    public OperatorTiers getTiers() {
        return tiers;
    }

    private Subtree parseExpression(Cursor cursor) {
        return parseBinary(cursor, tiers.additive(), true);
    }

    private Subtree parseTerm(Cursor cursor) {
        return parseBinary(cursor, tiers.multiplicative(), false);
    }

    private Subtree parseBinary(Cursor cursor, Set<String> operators, boolean additive) {
        Subtree left = additive ? parseTerm(cursor) : parseFactor(cursor);

        while (cursor.atOperator(operators)) {
            String operator = cursor.advance().text();
            Subtree right = additive ? parseTerm(cursor) : parseFactor(cursor);
            int depth = Math.max(left.depth(), right.depth()) + 1;
            if (depth > MAX_DEPTH) {
                throw new AllocationException("Expression tree exceeds maximum depth of " + MAX_DEPTH);
            }
            left = new Subtree(new BinaryOpNode(operator, left.node(), right.node()), depth);
        }

        return left;
    }

    private Subtree parseFactor(Cursor cursor) {
        Token token = cursor.current()
                .orElseThrow(() -> cursor.unexpectedEnd("expected identifier or number"));

        return switch (token.category()) {
            case IDENTIFIER -> {
                cursor.advance();
                yield new Subtree(new IdentifierNode(token.text()), 1);
            }
            case NUMBER -> {
                cursor.advance();
                yield new Subtree(new NumberNode(token.text()), 1);
            }
            default -> throw cursor.unexpected(token, "expected identifier or number");
        };
    }

    private record Subtree(AstNode node, int depth) {
    }

    /**
     * Read position over a token stream. Only moves forward and clamps at the end.
     */
    private static final class Cursor {

        private final TokenStream tokens;
        private int index;

        Cursor(TokenStream tokens) {
            this.tokens = tokens;
            this.index = 0;
        }

        Optional<Token> current() {
            if (index >= tokens.size()) {
                return Optional.empty();
            }
            return Optional.of(tokens.get(index));
        }

        Token advance() {
            Token token = current().orElseThrow(() -> unexpectedEnd("no token to consume"));
            index++;
            return token;
        }

        boolean atOperator(Set<String> operators) {
            return current()
                    .filter(t -> t.is(TokenCategory.OPERATOR))
                    .map(t -> operators.contains(t.text()))
                    .orElse(false);
        }

        ParseException unexpected(Token token, String message) {
            return new ParseException(ParseException.Kind.UNEXPECTED_TOKEN, token.column(),
                    "unexpected " + token + ", " + message);
        }

        ParseException unexpectedEnd(String message) {
            return new ParseException(ParseException.Kind.UNEXPECTED_END, tokens.size() + 1,
                    "unexpected end of input, " + message);
        }
    }
}
