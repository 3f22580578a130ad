package com.causaltest.dag.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Parser for the Graphviz dot language, restricted to directed graphs.
 *
 * <p>
 * Implements a recursive descent parser over the dot grammar, sufficient to read
 * the causal DAG files produced by hand or by graph editors. Only the structure
 * (nodes, edges and their attributes) is retained; layout statements are
 * accepted and discarded.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>{@code strict} and {@code digraph} headers with an optional graph id</li>
 * <li>Node statements with attribute lists {@code A [label="Age"]}</li>
 * <li>Edge chains {@code A -> B -> C} with attribute lists</li>
 * <li>Subgraphs as edge endpoints {@code {A B} -> C}</li>
 * <li>{@code graph}/{@code node}/{@code edge} default attribute statements and
 * {@code id = id} assignments (ignored)</li>
 * <li>Identifiers, numerals, quoted strings (with {@code +} concatenation) and
 * HTML strings</li>
 * <li>Ports on node ids (ignored), {@code //}, {@code /* *}{@code /} and
 * {@code #} comments</li>
 * </ul>
 * Undirected graphs are rejected: a causal structure must be directed.
 */
public final class DotParser {
    private DotParser() {
        // Utility class
    }

    /** Parses a dot file into a GraphDefinition. */
    public static GraphDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses dot text into a GraphDefinition. */
    public static GraphDefinition parse(String dot) {
        return new Reader(dot).parseGraph();
    }

    private enum Kind {
        ID, LBRACE, RBRACE, LBRACKET, RBRACKET, SEMI, COMMA, EQUALS, COLON, ARROW, UNDIRECTED, EOF
    }

    private record Token(Kind kind, String text, boolean keyword, int line, int column) {
        boolean is(String word) {
            return kind == Kind.ID && keyword && text.equalsIgnoreCase(word);
        }
    }

    /** Tokenizer and recursive descent parser in one pass. */
    private static final class Reader {
        private static final Set<String> KEYWORDS = Set.of("strict", "graph", "digraph", "node", "edge",
                "subgraph");

        private final String input;
        private int pos;
        private int line = 1;
        private int column = 1;
        private Token lookahead;
        private GraphDefinition def;
        private final Map<List<String>, GraphDefinition.EdgeDef> edgeIndex = new HashMap<>();

        Reader(String input) {
            this.input = input;
        }

        GraphDefinition parseGraph() {
            def = new GraphDefinition();
            Token t = next();
            if (t.is("strict")) {
                def.setStrict(true);
                t = next();
            }
            if (t.is("graph"))
                throw err("Undirected graphs are not supported, use digraph", t);
            if (!t.is("digraph"))
                throw err("Expected 'digraph'", t);
            if (peek().kind == Kind.ID && !peek().keyword)
                def.setName(next().text);
            expect(Kind.LBRACE, "'{'");
            parseStatements();
            expect(Kind.RBRACE, "'}'");
            Token end = next();
            if (end.kind != Kind.EOF)
                throw err("Unexpected content after graph", end);
            return def;
        }

        private void parseStatements() {
            while (peek().kind != Kind.RBRACE && peek().kind != Kind.EOF) {
                parseStatement();
                if (peek().kind == Kind.SEMI)
                    next();
            }
        }

        // Returns the node ids mentioned by the statement, used when a subgraph is
        // an edge endpoint.
        private List<String> parseStatement() {
            Token t = peek();
            if (t.is("graph") || t.is("node") || t.is("edge")) {
                next();
                parseAttributes();
                return List.of();
            }
            if (t.kind == Kind.ID && !t.keyword) {
                next();
                if (peek().kind == Kind.EQUALS) {
                    next();
                    expectId();
                    return List.of();
                }
                skipPort();
                return parseNodeOrEdge(List.of(t.text), true);
            }
            if (t.kind == Kind.LBRACE || t.is("subgraph"))
                return parseNodeOrEdge(parseSubgraph(), false);
            throw err("Unexpected " + describe(t), t);
        }

        private List<String> parseNodeOrEdge(List<String> first, boolean single) {
            for (String n : first)
                def.node(n);
            if (peek().kind == Kind.UNDIRECTED)
                throw err("Undirected edge '--' in a digraph", peek());
            if (peek().kind != Kind.ARROW) {
                Map<String, String> attrs = parseAttributes();
                if (single)
                    def.node(first.get(0)).getAttributes().putAll(attrs);
                return first;
            }

            List<List<String>> chain = new ArrayList<>();
            chain.add(first);
            while (peek().kind == Kind.ARROW) {
                next();
                chain.add(parseEndpoint());
                if (peek().kind == Kind.UNDIRECTED)
                    throw err("Undirected edge '--' in a digraph", peek());
            }
            Map<String, String> attrs = parseAttributes();
            for (int i = 0; i + 1 < chain.size(); i++)
                for (String source : chain.get(i))
                    for (String target : chain.get(i + 1))
                        addEdge(source, target, attrs);

            List<String> mentioned = new ArrayList<>();
            chain.forEach(mentioned::addAll);
            return mentioned;
        }

        private List<String> parseEndpoint() {
            Token t = peek();
            if (t.kind == Kind.LBRACE || t.is("subgraph"))
                return parseSubgraph();
            String id = expectId();
            skipPort();
            def.node(id);
            return List.of(id);
        }

        private List<String> parseSubgraph() {
            if (peek().is("subgraph")) {
                next();
                if (peek().kind == Kind.ID && !peek().keyword)
                    next();
            }
            expect(Kind.LBRACE, "'{'");
            Set<String> members = new LinkedHashSet<>();
            while (peek().kind != Kind.RBRACE && peek().kind != Kind.EOF) {
                members.addAll(parseStatement());
                if (peek().kind == Kind.SEMI)
                    next();
            }
            expect(Kind.RBRACE, "'}'");
            for (String m : members)
                def.node(m);
            return new ArrayList<>(members);
        }

        private void addEdge(String source, String target, Map<String, String> attrs) {
            def.node(source);
            def.node(target);
            List<String> key = List.of(source, target);
            GraphDefinition.EdgeDef ed = edgeIndex.get(key);
            if (ed == null) {
                ed = new GraphDefinition.EdgeDef(source, target);
                edgeIndex.put(key, ed);
                def.getEdges().add(ed);
            }
            ed.getAttributes().putAll(attrs);
        }

        private Map<String, String> parseAttributes() {
            Map<String, String> attrs = new LinkedHashMap<>();
            while (peek().kind == Kind.LBRACKET) {
                next();
                while (peek().kind != Kind.RBRACKET) {
                    String key = expectId();
                    String value = "true";
                    if (peek().kind == Kind.EQUALS) {
                        next();
                        value = expectId();
                    }
                    attrs.put(key, value);
                    if (peek().kind == Kind.SEMI || peek().kind == Kind.COMMA)
                        next();
                }
                next();
            }
            return attrs;
        }

        private void skipPort() {
            while (peek().kind == Kind.COLON) {
                next();
                expectId();
            }
        }

        private String expectId() {
            Token t = next();
            if (t.kind != Kind.ID)
                throw err("Expected identifier but found " + describe(t), t);
            return t.text;
        }

        private void expect(Kind kind, String what) {
            Token t = next();
            if (t.kind != kind)
                throw err("Expected " + what + " but found " + describe(t), t);
        }

        // ── Tokenizer ────────────────────────────────────────────────────

        private Token peek() {
            if (lookahead == null)
                lookahead = scan();
            return lookahead;
        }

        private Token next() {
            Token t = peek();
            lookahead = null;
            return t;
        }

        private Token scan() {
            skipTrivia();
            int l = line, c = column;
            if (pos >= input.length())
                return new Token(Kind.EOF, "", false, l, c);
            char ch = input.charAt(pos);
            switch (ch) {
                case '{':
                    return punct(Kind.LBRACE, l, c);
                case '}':
                    return punct(Kind.RBRACE, l, c);
                case '[':
                    return punct(Kind.LBRACKET, l, c);
                case ']':
                    return punct(Kind.RBRACKET, l, c);
                case ';':
                    return punct(Kind.SEMI, l, c);
                case ',':
                    return punct(Kind.COMMA, l, c);
                case '=':
                    return punct(Kind.EQUALS, l, c);
                case ':':
                    return punct(Kind.COLON, l, c);
                case '"':
                    return new Token(Kind.ID, quoted(), false, l, c);
                case '<':
                    return new Token(Kind.ID, html(), false, l, c);
                default:
                    break;
            }
            if (ch == '-' && pos + 1 < input.length()) {
                char n = input.charAt(pos + 1);
                if (n == '>' || n == '-') {
                    advance();
                    advance();
                    return new Token(n == '>' ? Kind.ARROW : Kind.UNDIRECTED, n == '>' ? "->" : "--", false, l, c);
                }
            }
            if (ch == '-' || ch == '.' || Character.isDigit(ch))
                return new Token(Kind.ID, numeral(), false, l, c);
            if (Character.isLetter(ch) || ch == '_' || ch >= 0x80) {
                int s = pos;
                while (pos < input.length()) {
                    char x = input.charAt(pos);
                    if (!(Character.isLetterOrDigit(x) || x == '_' || x >= 0x80))
                        break;
                    advance();
                }
                String text = input.substring(s, pos);
                return new Token(Kind.ID, text, KEYWORDS.contains(text.toLowerCase(Locale.ROOT)), l, c);
            }
            throw new DotParseException("Unexpected character '" + ch + "'", l, c);
        }

        private Token punct(Kind kind, int l, int c) {
            String text = String.valueOf(input.charAt(pos));
            advance();
            return new Token(kind, text, false, l, c);
        }

        private String quoted() {
            StringBuilder sb = new StringBuilder();
            while (true) {
                int l = line, c = column;
                advance(); // opening quote
                boolean closed = false;
                while (pos < input.length()) {
                    char x = input.charAt(pos);
                    advance();
                    if (x == '"') {
                        closed = true;
                        break;
                    }
                    if (x == '\\' && pos < input.length()) {
                        char e = input.charAt(pos);
                        advance();
                        if (e == '\n')
                            continue;
                        if (e != '"')
                            sb.append('\\');
                        sb.append(e);
                    } else
                        sb.append(x);
                }
                if (!closed)
                    throw new DotParseException("Unterminated string", l, c);

                // "a" + "b" concatenation
                int save = pos, saveLine = line, saveColumn = column;
                skipTrivia();
                if (pos < input.length() && input.charAt(pos) == '+') {
                    advance();
                    skipTrivia();
                    if (pos < input.length() && input.charAt(pos) == '"')
                        continue;
                    throw new DotParseException("Expected string after '+'", line, column);
                }
                pos = save;
                line = saveLine;
                column = saveColumn;
                return sb.toString();
            }
        }

        private String html() {
            int l = line, c = column;
            int depth = 0;
            int s = pos;
            while (pos < input.length()) {
                char x = input.charAt(pos);
                advance();
                if (x == '<')
                    depth++;
                else if (x == '>' && --depth == 0)
                    return input.substring(s + 1, pos - 1);
            }
            throw new DotParseException("Unterminated HTML string", l, c);
        }

        private String numeral() {
            int s = pos;
            if (input.charAt(pos) == '-')
                advance();
            boolean digits = false;
            while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                advance();
                digits = true;
            }
            if (pos < input.length() && input.charAt(pos) == '.') {
                advance();
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    advance();
                    digits = true;
                }
            }
            if (!digits)
                throw new DotParseException("Malformed numeral", line, column);
            return input.substring(s, pos);
        }

        private void skipTrivia() {
            while (pos < input.length()) {
                char x = input.charAt(pos);
                if (Character.isWhitespace(x)) {
                    advance();
                } else if (x == '#' && atLineStart()) {
                    skipLine();
                } else if (x == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '/') {
                    skipLine();
                } else if (x == '/' && pos + 1 < input.length() && input.charAt(pos + 1) == '*') {
                    int l = line, c = column;
                    advance();
                    advance();
                    while (pos < input.length() && !input.startsWith("*/", pos))
                        advance();
                    if (pos >= input.length())
                        throw new DotParseException("Unterminated comment", l, c);
                    advance();
                    advance();
                } else {
                    return;
                }
            }
        }

        // '#' lines are preprocessor output and only count at the start of a line.
        private boolean atLineStart() {
            for (int i = pos - 1; i >= 0; i--) {
                char x = input.charAt(i);
                if (x == '\n')
                    return true;
                if (!Character.isWhitespace(x))
                    return false;
            }
            return true;
        }

        private void skipLine() {
            while (pos < input.length() && input.charAt(pos) != '\n')
                advance();
        }

        private void advance() {
            if (input.charAt(pos++) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }

        private static String describe(Token t) {
            return t.kind == Kind.EOF ? "end of input" : "'" + t.text + "'";
        }

        private static DotParseException err(String msg, Token t) {
            return new DotParseException(msg, t.line, t.column);
        }
    }
}
