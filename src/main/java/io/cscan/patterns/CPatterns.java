package io.cscan.patterns;

import io.cscan.source.SourceText;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless recognizers for the C constructs the analyzer understands.
 * <p>
 * None of these parse C properly. Each returns empty when the text does not have the
 * expected shape, and callers treat that as "nothing to say about this clause".
 */
public final class CPatterns {

    public static final Set<String> KEYWORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double",
            "else", "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long",
            "register", "restrict", "return", "short", "signed", "sizeof", "static", "struct",
            "switch", "typedef", "union", "unsigned", "void", "volatile", "while", "_Bool",
            "bool", "true", "false", "NULL");

    private static final Set<String> QUALIFIERS = Set.of(
            "static", "const", "volatile", "register", "extern", "auto", "inline", "typedef", "restrict");

    private static final Set<String> TYPE_WORDS = Set.of(
            "void", "char", "short", "int", "long", "float", "double", "signed", "unsigned",
            "_Bool", "bool");

    private static final Set<String> NAMED_TYPES = Set.of("FILE", "size_t", "ssize_t", "ptrdiff_t", "wchar_t");

    private static final Pattern DECLARATOR = Pattern.compile(
            "^(\\**)\\s*(?:const\\s+)?([A-Za-z_]\\w*)\\s*((?:\\[[^\\]]*\\]\\s*)*)(?:=\\s*(.*))?$", Pattern.DOTALL);

    private static final Pattern FUNCTION_DECLARATOR = Pattern.compile(
            "^(\\**)\\s*([A-Za-z_]\\w*)\\s*\\(", Pattern.DOTALL);

    private static final Pattern ASSIGNMENT_TARGET = Pattern.compile("^[\\w\\s*.\\[\\]()>-]+$");

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");

    private static final Pattern STAR_DEREF = Pattern.compile(
            "(?:^|[=(,!&|?:;{}+\\-<>\\[~%/]|\\breturn)\\s*\\*+\\s*\\(?\\s*([A-Za-z_]\\w*)");

    private static final Pattern ARROW_DEREF = Pattern.compile("(?<![.>\\w])([A-Za-z_]\\w*)\\s*->");

    private static final Pattern INDEX_DEREF = Pattern.compile("(?<![.>\\w])([A-Za-z_]\\w*)\\s*\\[");

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![\\w.])[A-Za-z_]\\w*");

    private static final Pattern CALL = Pattern.compile("(?<![\\w.])([A-Za-z_]\\w*)\\s*\\(");

    private static final Pattern ALLOCATION = Pattern.compile(
            "^(?:\\(\\s*[^()]*\\)\\s*)?(malloc|calloc|realloc)\\s*\\(");

    private static final Pattern NULL_VALUE = Pattern.compile(
            "^(?:\\(\\s*void\\s*\\*\\s*\\)\\s*)?(?:NULL|0|nullptr)$");

    private static final Pattern NOT_EQUAL = Pattern.compile("^(.+?)\\s*!=\\s*(.+)$");

    private static final Pattern CAST_PREFIX = Pattern.compile("^\\(\\s*[A-Za-z_][\\w\\s]*\\**\\s*\\)\\s*");

    private static final Pattern INCLUDE = Pattern.compile("^#\\s*include\\s*[<\"]([^>\"]+)[>\"]");

    private static final Pattern DEFINE = Pattern.compile("^#\\s*define\\s+([A-Za-z_]\\w*)\\s+(.+)$");

    private static final Pattern INTEGER = Pattern.compile(
            "^(0[xX][0-9a-fA-F]+|0[bB][01]+|0[0-7]*|[1-9][0-9]*)(?:[uU][lL]{0,2}|[lL]{1,2}[uU]?)?$");

    private static final Pattern CHAR_LITERAL = Pattern.compile("^'(\\\\.[^']*|[^'\\\\])'$");

    private static final Pattern AGGREGATE_HEAD = Pattern.compile(
            "^(typedef\\s+)?(struct|union|enum)(\\s+[A-Za-z_]\\w*)?\\s*$");

    private static final Pattern INCREMENT = Pattern.compile(
            "(?:(\\+\\+|--)\\s*([A-Za-z_]\\w*))|(?:([A-Za-z_]\\w*)\\s*(\\+\\+|--))");

    private CPatterns() {
    }

    // ---------------------------------------------------------------- declarations

    /**
     * A variable declaration statement.
     *
     * @param baseType    type words without qualifiers, e.g. "unsigned char" or "struct node"
     * @param isStatic    declared {@code static}
     * @param isExtern    declared {@code extern}
     * @param isTypedef   a {@code typedef}; the declarators name new types
     * @param aggregate   struct/union or typedef'd struct type
     * @param declarators declared names in order
     */
    public record Declaration(String baseType, boolean isStatic, boolean isExtern, boolean isTypedef,
                              boolean aggregate, List<Declarator> declarators) {}

    /**
     * @param name         declared identifier
     * @param pointerDepth number of leading '*'
     * @param array        has one or more [] suffixes
     * @param initializer  text after '=', or null
     */
    public record Declarator(String name, int pointerDepth, boolean array, String initializer) {
        public boolean hasInitializer() {
            return initializer != null;
        }
    }

    /**
     * A function definition header or prototype.
     */
    public record FunctionSignature(String returnType, String name, List<Declarator> parameters,
                                    List<String> parameterTypes) {}

    private record Head(String baseType, boolean isStatic, boolean isExtern, boolean isTypedef,
                        boolean aggregate, int end) {}

    /**
     * Parses the type prefix of a declaration. Typedef names map to whether they denote a struct.
     */
    private static Optional<Head> parseHead(String s, Map<String, Boolean> typedefs) {
        List<String> typeWords = new ArrayList<>();
        boolean sawNamedType = false;
        boolean isStatic = false;
        boolean isExtern = false;
        boolean isTypedef = false;
        boolean aggregate = false;
        int i = 0;
        while (true) {
            int wordStart = SourceText.skipSpaces(s, i);
            int wordEnd = wordStart;
            while (wordEnd < s.length() && SourceText.isIdentifierChar(s.charAt(wordEnd))) {
                wordEnd++;
            }
            if (wordEnd == wordStart || !SourceText.isIdentifierStart(s.charAt(wordStart))) {
                break;
            }
            String word = s.substring(wordStart, wordEnd);
            if (QUALIFIERS.contains(word)) {
                isStatic |= word.equals("static");
                isExtern |= word.equals("extern");
                isTypedef |= word.equals("typedef");
                i = wordEnd;
                continue;
            }
            if (typeWords.isEmpty() && (word.equals("struct") || word.equals("union") || word.equals("enum"))) {
                int tagStart = SourceText.skipSpaces(s, wordEnd);
                int tagEnd = tagStart;
                while (tagEnd < s.length() && SourceText.isIdentifierChar(s.charAt(tagEnd))) {
                    tagEnd++;
                }
                if (tagEnd == tagStart) {
                    return Optional.empty();
                }
                typeWords.add(word + " " + s.substring(tagStart, tagEnd));
                sawNamedType = true;
                aggregate = !word.equals("enum");
                i = tagEnd;
                continue;
            }
            if (TYPE_WORDS.contains(word) && !sawNamedType) {
                typeWords.add(word);
                i = wordEnd;
                continue;
            }
            if (typeWords.isEmpty() && (NAMED_TYPES.contains(word) || typedefs.containsKey(word)
                    || (word.endsWith("_t") && word.length() > 2))) {
                typeWords.add(word);
                sawNamedType = true;
                aggregate = typedefs.getOrDefault(word, false);
                i = wordEnd;
                continue;
            }
            break;
        }
        if (typeWords.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Head(String.join(" ", typeWords), isStatic, isExtern, isTypedef, aggregate, i));
    }

    /**
     * Parses {@code [qualifiers] type declarator [= init] {, declarator [= init]}}.
     */
    public static Optional<Declaration> parseDeclaration(String statement, Map<String, Boolean> typedefs) {
        String s = statement.trim();
        Optional<Head> head = parseHead(s, typedefs);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        String rest = s.substring(head.get().end()).trim();
        if (rest.isEmpty()) {
            return Optional.empty();
        }
        List<Declarator> declarators = new ArrayList<>();
        for (String part : SourceText.splitTopLevel(rest, ',')) {
            Matcher m = DECLARATOR.matcher(part.trim());
            if (!m.matches() || KEYWORDS.contains(m.group(2))) {
                return Optional.empty();
            }
            String init = m.group(4);
            declarators.add(new Declarator(m.group(2), m.group(1).length(), !m.group(3).isEmpty(),
                    init != null ? init.trim() : null));
        }
        Head h = head.get();
        return Optional.of(new Declaration(h.baseType(), h.isStatic(), h.isExtern(), h.isTypedef(),
                h.aggregate(), declarators));
    }

    /**
     * Parses {@code type name(params)} with nothing after the closing parenthesis.
     * Array parameters are reported as pointers.
     */
    public static Optional<FunctionSignature> parseFunctionHeader(String text, Map<String, Boolean> typedefs) {
        String s = text.trim();
        Optional<Head> head = parseHead(s, typedefs);
        if (head.isEmpty() || head.get().isTypedef()) {
            return Optional.empty();
        }
        String rest = s.substring(head.get().end());
        Matcher m = FUNCTION_DECLARATOR.matcher(rest.trim());
        if (!m.find()) {
            return Optional.empty();
        }
        String trimmedRest = rest.trim();
        int open = m.end() - 1;
        String masked = SourceText.maskLiterals(trimmedRest);
        int close = SourceText.matchingParen(masked, open);
        if (close < 0 || !trimmedRest.substring(close + 1).isBlank()) {
            return Optional.empty();
        }
        String inner = trimmedRest.substring(open + 1, close).trim();
        List<Declarator> parameters = new ArrayList<>();
        List<String> parameterTypes = new ArrayList<>();
        if (!inner.isEmpty() && !inner.equals("void")) {
            for (String param : SourceText.splitTopLevel(inner, ',')) {
                String p = param.trim();
                if (p.equals("...")) {
                    continue;
                }
                Optional<Declaration> decl = parseDeclaration(p, typedefs);
                if (decl.isEmpty() || decl.get().declarators().size() != 1) {
                    continue;
                }
                Declarator d = decl.get().declarators().get(0);
                parameters.add(new Declarator(d.name(), d.pointerDepth() + (d.array() ? 1 : 0), false, null));
                parameterTypes.add(decl.get().baseType());
            }
        }
        return Optional.of(new FunctionSignature(head.get().baseType(), m.group(2), parameters, parameterTypes));
    }

    /**
     * Matches a struct/union/enum head whose member list opens next, e.g. {@code typedef struct node}.
     *
     * @return true when the body that follows is a member list
     */
    public static boolean isAggregateHead(String statement) {
        return AGGREGATE_HEAD.matcher(statement.trim()).matches();
    }

    public static boolean isTypedefHead(String statement) {
        return statement.trim().startsWith("typedef");
    }

    // ---------------------------------------------------------------- assignments

    /**
     * A top-level assignment {@code target op value}.
     *
     * @param target      left-hand side as written
     * @param operator    "=", "+=", "&lt;&lt;=" ...
     * @param value       right-hand side
     */
    public record Assignment(String target, String operator, String value) {
        public boolean isPlain() {
            return operator.equals("=");
        }
    }

    public enum TargetKind { PLAIN, DEREF, ELEMENT, MEMBER }

    /**
     * What an assignment writes to.
     *
     * @param base the variable named at the start of the target
     * @param kind how the variable is reached
     */
    public record Target(String base, TargetKind kind) {}

    private static final Pattern DEREF_TARGET = Pattern.compile("^\\*+\\s*\\(?\\s*([A-Za-z_]\\w*)");
    private static final Pattern ELEMENT_TARGET = Pattern.compile("^([A-Za-z_]\\w*)\\s*\\[");
    private static final Pattern MEMBER_TARGET = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:\\.|->)");

    public static Optional<Assignment> parseAssignment(String statement) {
        String masked = SourceText.maskLiterals(statement);
        int depth = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
                continue;
            }
            if (c == ')' || c == ']') {
                depth = Math.max(0, depth - 1);
                continue;
            }
            if (c != '=' || depth > 0) {
                continue;
            }
            if (i + 1 < masked.length() && masked.charAt(i + 1) == '=') {
                i++;
                continue;
            }
            char prev = i > 0 ? masked.charAt(i - 1) : 0;
            int targetEnd;
            String operator;
            if (prev != 0 && "+-*/%&|^".indexOf(prev) >= 0) {
                operator = prev + "=";
                targetEnd = i - 1;
            } else if (prev == '<' || prev == '>') {
                if (i < 2 || masked.charAt(i - 2) != prev) {
                    continue;
                }
                operator = "" + prev + prev + "=";
                targetEnd = i - 2;
            } else if (prev == '!' || prev == '=') {
                continue;
            } else {
                operator = "=";
                targetEnd = i;
            }
            String target = statement.substring(0, targetEnd).trim();
            if (target.isEmpty() || !ASSIGNMENT_TARGET.matcher(target).matches()) {
                return Optional.empty();
            }
            return Optional.of(new Assignment(target, operator, statement.substring(i + 1).trim()));
        }
        return Optional.empty();
    }

    public static Optional<Target> classifyTarget(String target) {
        String t = target.trim();
        while (t.startsWith("(") && t.endsWith(")")
                && SourceText.matchingParen(t, 0) == t.length() - 1) {
            t = t.substring(1, t.length() - 1).trim();
        }
        if (PLAIN_IDENTIFIER.matcher(t).matches()) {
            return Optional.of(new Target(t, TargetKind.PLAIN));
        }
        Matcher m = DEREF_TARGET.matcher(t);
        if (m.find()) {
            return Optional.of(new Target(m.group(1), TargetKind.DEREF));
        }
        m = ELEMENT_TARGET.matcher(t);
        if (m.find()) {
            return Optional.of(new Target(m.group(1), TargetKind.ELEMENT));
        }
        m = MEMBER_TARGET.matcher(t);
        if (m.find()) {
            return Optional.of(new Target(m.group(1), TargetKind.MEMBER));
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------- expressions

    public enum DerefKind { STAR, ARROW, INDEX }

    /**
     * A pointer dereference.
     *
     * @param name     the dereferenced identifier
     * @param kind     {@code *p}, {@code p->x} or {@code p[i]}
     * @param position index of the identifier
     */
    public record Dereference(String name, DerefKind kind, int position) {}

    /**
     * @param name  identifier text
     * @param start index of its first character
     * @param end   index just past it
     */
    public record IdentifierUse(String name, int start, int end) {}

    /**
     * A function call.
     *
     * @param name      called function
     * @param start     index of the name
     * @param arguments argument texts, trimmed; empty for {@code f()}
     */
    public record Call(String name, int start, List<String> arguments) {}

    /**
     * Finds dereferences in masked text, in order of position.
     */
    public static List<Dereference> dereferences(String masked) {
        List<Dereference> result = new ArrayList<>();
        Matcher m = STAR_DEREF.matcher(masked);
        while (m.find()) {
            result.add(new Dereference(m.group(1), DerefKind.STAR, m.start(1)));
        }
        m = ARROW_DEREF.matcher(masked);
        while (m.find()) {
            result.add(new Dereference(m.group(1), DerefKind.ARROW, m.start(1)));
        }
        m = INDEX_DEREF.matcher(masked);
        while (m.find()) {
            result.add(new Dereference(m.group(1), DerefKind.INDEX, m.start(1)));
        }
        result.sort((a, b) -> Integer.compare(a.position(), b.position()));
        return result;
    }

    /**
     * Returns true if the identifier at {@code use} is dereferenced there.
     */
    public static boolean isDereferenced(String masked, IdentifierUse use) {
        char next = SourceText.nextNonSpace(masked, use.end());
        if (next == '[') {
            return true;
        }
        int after = SourceText.skipSpaces(masked, use.end());
        if (masked.startsWith("->", after)) {
            return true;
        }
        for (Dereference d : dereferences(masked)) {
            if (d.position() == use.start()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds identifiers in masked text. Member names after '.' are skipped.
     */
    public static List<IdentifierUse> identifiers(String masked) {
        List<IdentifierUse> result = new ArrayList<>();
        Matcher m = IDENTIFIER.matcher(masked);
        while (m.find()) {
            result.add(new IdentifierUse(m.group(), m.start(), m.end()));
        }
        return result;
    }

    /**
     * Finds calls in the given text (not masked), excluding control keywords and member calls.
     */
    public static List<Call> calls(String text) {
        String masked = SourceText.maskLiterals(text);
        List<Call> result = new ArrayList<>();
        Matcher m = CALL.matcher(masked);
        while (m.find()) {
            String name = m.group(1);
            if (KEYWORDS.contains(name) || isMemberAccess(masked, m.start(1))) {
                continue;
            }
            int open = m.end() - 1;
            int close = SourceText.matchingParen(masked, open);
            String inner = text.substring(open + 1, close < 0 ? text.length() : close);
            List<String> args = new ArrayList<>();
            if (!inner.isBlank()) {
                for (String arg : SourceText.splitTopLevel(inner, ',')) {
                    args.add(arg.trim());
                }
            }
            result.add(new Call(name, m.start(1), args));
        }
        return result;
    }

    /**
     * Returns true if the identifier starting at {@code index} follows '.' or "->".
     */
    public static boolean isMemberAccess(String masked, int index) {
        char prev = SourceText.previousNonSpace(masked, index);
        if (prev == '.') {
            return true;
        }
        if (prev == '>') {
            int at = index - 1;
            while (at >= 0 && Character.isWhitespace(masked.charAt(at))) {
                at--;
            }
            return at >= 1 && masked.charAt(at - 1) == '-';
        }
        return false;
    }

    /**
     * Returns true if the identifier starting at {@code index} is the operand of unary '&'.
     */
    public static boolean isAddressOf(String masked, int index) {
        int at = index - 1;
        while (at >= 0 && Character.isWhitespace(masked.charAt(at))) {
            at--;
        }
        if (at < 0 || masked.charAt(at) != '&') {
            return false;
        }
        if (at > 0 && masked.charAt(at - 1) == '&') {
            return false;
        }
        char before = SourceText.previousNonSpace(masked, at);
        return !(SourceText.isIdentifierChar(before) || before == ')' || before == ']');
    }

    /**
     * Names written by {@code ++}/{@code --}, in order of appearance.
     */
    public static List<String> incremented(String masked) {
        List<String> names = new ArrayList<>();
        Matcher m = INCREMENT.matcher(masked);
        while (m.find()) {
            int start = m.group(2) != null ? m.start(2) : m.start(3);
            if (isMemberAccess(masked, start)) {
                continue;
            }
            names.add(m.group(2) != null ? m.group(2) : m.group(3));
        }
        return names;
    }

    public static boolean isAllocation(String expression) {
        return ALLOCATION.matcher(expression.trim()).find();
    }

    public static boolean isNullValue(String expression) {
        return NULL_VALUE.matcher(stripParens(expression)).matches();
    }

    /**
     * Names a condition proves non-null while it holds: {@code p}, {@code p != NULL} or
     * {@code NULL != p}, alone or joined by {@code &&}. A top-level {@code ||} proves nothing.
     */
    public static List<String> nonNullTested(String condition) {
        String c = stripParens(condition);
        String masked = SourceText.maskLiterals(c);
        List<String> conjuncts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i + 1 < masked.length(); i++) {
            char ch = masked.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (depth == 0 && (ch == '&' || ch == '|') && masked.charAt(i + 1) == ch) {
                if (ch == '|') {
                    return List.of();
                }
                conjuncts.add(c.substring(start, i));
                start = i + 2;
                i++;
            }
        }
        conjuncts.add(c.substring(start));

        List<String> names = new ArrayList<>();
        for (String conjunct : conjuncts) {
            String term = stripParens(conjunct);
            if (isPlainIdentifier(term)) {
                names.add(term);
                continue;
            }
            Matcher m = NOT_EQUAL.matcher(term);
            if (!m.matches()) {
                continue;
            }
            String left = stripParens(m.group(1));
            String right = stripParens(m.group(2));
            if (isPlainIdentifier(left) && isNullValue(right)) {
                names.add(left);
            } else if (isNullValue(left) && isPlainIdentifier(right)) {
                names.add(right);
            }
        }
        return names;
    }

    public static boolean isPlainIdentifier(String text) {
        return PLAIN_IDENTIFIER.matcher(text.trim()).matches();
    }

    /**
     * Strips redundant outer parentheses and a leading cast: {@code ((char *) p)} gives {@code p}.
     */
    public static String stripCastsAndParens(String expression) {
        String previous;
        String e = expression.trim();
        do {
            previous = e;
            e = stripParens(e);
            Matcher m = CAST_PREFIX.matcher(e);
            if (m.find() && m.end() < e.length()) {
                e = e.substring(m.end()).trim();
            }
        } while (!e.equals(previous));
        return e;
    }

    private static String stripParens(String expression) {
        String e = expression.trim();
        while (e.startsWith("(") && e.endsWith(")")
                && SourceText.matchingParen(SourceText.maskLiterals(e), 0) == e.length() - 1) {
            e = e.substring(1, e.length() - 1).trim();
        }
        return e;
    }

    // ---------------------------------------------------------------- literals

    /**
     * Parses an integer constant: decimal, hex, octal or binary with optional suffix and sign,
     * or a character constant.
     */
    public static OptionalLong parseIntegerLiteral(String text) {
        String t = stripParens(text);
        boolean negative = false;
        if (t.startsWith("-") || t.startsWith("+")) {
            negative = t.startsWith("-");
            t = stripParens(t.substring(1));
        }
        OptionalLong magnitude = parseUnsigned(t);
        if (magnitude.isEmpty()) {
            return magnitude;
        }
        return OptionalLong.of(negative ? -magnitude.getAsLong() : magnitude.getAsLong());
    }

    private static OptionalLong parseUnsigned(String t) {
        Matcher ch = CHAR_LITERAL.matcher(t);
        if (ch.matches()) {
            return charValue(ch.group(1));
        }
        Matcher m = INTEGER.matcher(t);
        if (!m.matches()) {
            return OptionalLong.empty();
        }
        String digits = m.group(1);
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                return OptionalLong.of(Long.parseLong(digits.substring(2), 16));
            }
            if (digits.startsWith("0b") || digits.startsWith("0B")) {
                return OptionalLong.of(Long.parseLong(digits.substring(2), 2));
            }
            if (digits.length() > 1 && digits.startsWith("0")) {
                return OptionalLong.of(Long.parseLong(digits.substring(1), 8));
            }
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            // wider than 64 bits
            return OptionalLong.empty();
        }
    }

    private static OptionalLong charValue(String body) {
        if (!body.startsWith("\\")) {
            return OptionalLong.of(body.charAt(0));
        }
        String escape = body.substring(1);
        long simple = switch (escape) {
            case "n" -> '\n';
            case "t" -> '\t';
            case "r" -> '\r';
            case "a" -> 7;
            case "b" -> 8;
            case "f" -> 12;
            case "v" -> 11;
            case "\\" -> '\\';
            case "'" -> '\'';
            case "\"" -> '"';
            case "?" -> '?';
            default -> -1;
        };
        if (simple >= 0) {
            return OptionalLong.of(simple);
        }
        try {
            if (escape.startsWith("x")) {
                return OptionalLong.of(Long.parseLong(escape.substring(1), 16));
            }
            return OptionalLong.of(Long.parseLong(escape, 8));
        } catch (NumberFormatException e) {
            // not a numeric escape
            return OptionalLong.empty();
        }
    }

    /**
     * Returns true for a floating constant with a fractional part or exponent, e.g. 0.1 or 1e-3.
     */
    public static boolean isFractionalLiteral(String text) {
        return stripParens(text).matches("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+[eE][-+]?\\d+)([eE][-+]?\\d+)?[fFlL]?");
    }

    // ---------------------------------------------------------------- directives

    public static Optional<String> includedHeader(String directive) {
        Matcher m = INCLUDE.matcher(directive.trim());
        return m.find() ? Optional.of(m.group(1).trim()) : Optional.empty();
    }

    /**
     * An object-like macro with an integer value.
     */
    public record MacroConstant(String name, long value) {}

    public static Optional<MacroConstant> defineConstant(String directive) {
        Matcher m = DEFINE.matcher(directive.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        OptionalLong value = parseIntegerLiteral(m.group(2).trim());
        return value.isPresent()
                ? Optional.of(new MacroConstant(m.group(1), value.getAsLong()))
                : Optional.empty();
    }
}
