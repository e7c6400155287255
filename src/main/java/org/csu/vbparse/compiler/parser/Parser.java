package org.csu.vbparse.compiler.parser;

import org.csu.vbparse.common.model.Diagnostic;
import org.csu.vbparse.common.model.DiagnosticKind;
import org.csu.vbparse.compiler.cst.Checkpoint;
import org.csu.vbparse.compiler.cst.TreeSink;
import org.csu.vbparse.compiler.lexer.Token;
import org.csu.vbparse.compiler.lexer.TokenType;
import org.csu.vbparse.compiler.syntax.SyntaxKind;

import java.util.List;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 语法分析器
 * 采用递归下降法，把 Token 流无损地写入 {@link TreeSink}，得到具体语法树(CST)。
 *
 * 语法错误不会抛出异常：无法识别的语句包装成 UNKNOWN 节点，
 * 缺失的部分以诊断信息的形式记录，解析继续进行。
 */
public class Parser {

    private static final Set<TokenType> MODIFIERS = Set.of(
            TokenType.PUBLIC, TokenType.PRIVATE, TokenType.FRIEND, TokenType.GLOBAL, TokenType.STATIC
    );

    private static final Set<TokenType> TYPE_SUFFIXES = Set.of(
            TokenType.DOLLAR, TokenType.PERCENT, TokenType.AMPERSAND, TokenType.BANG, TokenType.HASH, TokenType.AT
    );

    private static final Set<TokenType> COMPARISON_OPERATORS = Set.of(
            TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
            TokenType.GREATER, TokenType.GREATER_EQUAL
    );

    private final SyntaxEmitter emitter;
    private final ExpressionParser expressions;
    private final PropertyBlockParser propertyBlocks;
    private final ParserState state;
    private final ParserOptions options;

    public Parser(List<Token> tokens, TreeSink sink, ParserOptions options, String fileName) {
        this.options = options;
        this.state = new ParserState(options.startInHeader());
        this.emitter = new SyntaxEmitter(new TokenCursor(tokens), sink, state, options, fileName);
        this.expressions = new ExpressionParser(emitter);
        this.propertyBlocks = new PropertyBlockParser(emitter);
    }

    /**
     * 解析整个模块，根节点为 ROOT。
     */
    public void parse() {
        emitter.startNode(SyntaxKind.ROOT);
        parseStatementList(true);
        emitter.finishNode();
    }

    /**
     * @return 解析过程中记录的诊断信息，按出现顺序排列
     */
    public List<Diagnostic> getDiagnostics() {
        return List.copyOf(emitter.diagnostics());
    }

    // ================= 语句列表 =================

    /**
     * 逐条解析语句，直到输入结束或遇到任一外层块的结束/分段行。
     * 空行和纯注释行直接放在列表中。
     */
    private void parseStatementList(boolean atRoot) {
        while (true) {
            TokenType next = emitter.nth(0);
            if (next == TokenType.EOF) {
                if (atRoot) {
                    emitter.skipTrivia();
                }
                return;
            }
            if (state.inInlineIf()
                    && (next == TokenType.NEWLINE || next == TokenType.ELSE || next.isComment())) {
                return;
            }
            if (state.getPendingNextCloses() > 0) {
                return;
            }
            if (next == TokenType.NEWLINE || next.isComment()) {
                emitter.skipTrivia();
                if (next.isComment()) {
                    emitter.bump();
                }
                if (emitter.cursor().peek().type() == TokenType.NEWLINE) {
                    emitter.bump();
                }
                continue;
            }
            if (next == TokenType.COLON) {
                emitter.skipTrivia();
                emitter.bump();
                continue;
            }
            if (state.stopsAnyBlock(next, emitter.nth(1))) {
                return;
            }
            parseStatement();
        }
    }

    private void parseStatement() {
        Checkpoint checkpoint = emitter.checkpoint();
        emitter.skipTrivia();
        StatementRule rule = classify();
        if (!rule.keepsHeader()) {
            state.leaveHeader();
        }

        SyntaxKind kind;
        if (rule.isHeaderOnly() && !state.isInHeader()) {
            kind = parseMisplacedHeader(rule);
        } else if (rule.opensBlock()) {
            kind = parseNested(rule);
        } else {
            kind = dispatch(rule);
            if (rule != StatementRule.LABEL) {
                finishStatement();
            }
        }
        emitter.startNodeAt(checkpoint, kind);
        emitter.finishNode();
    }

    private SyntaxKind parseNested(StatementRule rule) {
        int maxDepth = options.maxNestingDepth();
        if (!state.enter(maxDepth)) {
            emitter.report(DiagnosticKind.NESTING_TOO_DEEP, "Blocks nested deeper than " + maxDepth + " levels");
            emitter.bumpUntilStatementEnd();
            finishStatement();
            return SyntaxKind.UNKNOWN;
        }
        SyntaxKind kind = dispatch(rule);
        state.exit();
        return kind;
    }

    private SyntaxKind dispatch(StatementRule rule) {
        return switch (rule) {
            case LABEL -> parseLabel();
            case VERSION -> parseFlatLine(SyntaxKind.VERSION_STATEMENT);
            case OBJECT -> parseFlatLine(SyntaxKind.OBJECT_STATEMENT);
            case ATTRIBUTE -> parseAttribute();
            case OPTION -> parseFlatLine(SyntaxKind.OPTION_STATEMENT);
            case PROPERTIES_BLOCK -> parsePropertiesBlock();
            case DIM -> parseDim();
            case CONST -> parseConst();
            case PROCEDURE -> parseProcedure();
            case DECLARE -> parseDeclare();
            case EVENT -> parseEvent();
            case IMPLEMENTS -> parseImplements();
            case TYPE -> parseType();
            case ENUM -> parseEnum();
            case RE_DIM -> parseReDim();
            case ERASE -> parseErase();
            case IF -> parseIf();
            case SELECT_CASE -> parseSelectCase();
            case FOR -> parseFor();
            case WHILE -> parseWhile();
            case DO -> parseDo();
            case WITH -> parseWith();
            case GO_TO -> parseJump(SyntaxKind.GO_TO_STATEMENT);
            case GO_SUB -> parseJump(SyntaxKind.GO_SUB_STATEMENT);
            case RETURN -> parseKeywordOnly(SyntaxKind.RETURN_STATEMENT);
            case RESUME -> parseResume();
            case EXIT -> parseExit();
            case ON -> parseOn();
            case END -> parseKeywordOnly(SyntaxKind.END_STATEMENT);
            case CALL -> parseCall();
            case RAISE_EVENT -> parseRaiseEvent();
            case SET -> parseKeywordAssignment(SyntaxKind.SET_STATEMENT);
            case LET -> parseKeywordAssignment(SyntaxKind.LET_STATEMENT);
            case LIBRARY -> parseLibraryStatement();
            case EXPRESSION -> parseExpressionStatement();
            case UNKNOWN -> parseUnknown();
        };
    }

    /**
     * 语句结束：多余的 Token 记一次诊断后并入当前语句，然后是尾部空白、
     * 可选的注释以及换行或冒号。单行 If 中的换行留给 If 语句本身。
     */
    private void finishStatement() {
        if (!emitter.atStatementEnd()) {
            emitter.report(DiagnosticKind.UNEXPECTED_TOKEN,
                    "Unexpected " + emitter.describeNext() + " at end of statement");
            emitter.bumpUntilStatementEnd();
        }
        emitter.skipTrivia();
        TokenCursor cursor = emitter.cursor();
        if (cursor.peek().type().isComment()) {
            emitter.bump();
        }
        TokenType terminator = cursor.peek().type();
        if (terminator == TokenType.COLON || (terminator == TokenType.NEWLINE && !state.inInlineIf())) {
            emitter.bump();
        }
    }

    // ================= 分类 =================

    private StatementRule classify() {
        TokenType first = emitter.nth(0);
        TokenType second = emitter.nth(1);

        if (isLabelStart(first)) {
            return StatementRule.LABEL;
        }
        switch (first) {
            case VERSION:
                if (second.isNumericLiteral()) {
                    return StatementRule.VERSION;
                }
                break;
            case OBJECT:
                if (second == TokenType.EQUAL) {
                    return StatementRule.OBJECT;
                }
                break;
            case BEGIN:
                if (second != TokenType.EQUAL) {
                    return StatementRule.PROPERTIES_BLOCK;
                }
                break;
            case ATTRIBUTE:
                return StatementRule.ATTRIBUTE;
            case OPTION:
                return StatementRule.OPTION;
            case PUBLIC, PRIVATE, FRIEND, GLOBAL, STATIC:
                return classifyModified();
            case DIM:
                return StatementRule.DIM;
            case CONST:
                return StatementRule.CONST;
            case SUB, FUNCTION:
                return StatementRule.PROCEDURE;
            case PROPERTY:
                return isAccessor(second) ? StatementRule.PROCEDURE : StatementRule.UNKNOWN;
            case DECLARE:
                return StatementRule.DECLARE;
            case EVENT:
                return StatementRule.EVENT;
            case IMPLEMENTS:
                return StatementRule.IMPLEMENTS;
            case TYPE:
                return StatementRule.TYPE;
            case ENUM:
                return StatementRule.ENUM;
            case RE_DIM:
                return StatementRule.RE_DIM;
            case ERASE:
                return StatementRule.ERASE;
            case IF:
                return StatementRule.IF;
            case SELECT:
                return second == TokenType.CASE ? StatementRule.SELECT_CASE : StatementRule.UNKNOWN;
            case FOR:
                return StatementRule.FOR;
            case WHILE:
                return StatementRule.WHILE;
            case DO:
                return StatementRule.DO;
            case WITH:
                return StatementRule.WITH;
            case GO_TO:
                return StatementRule.GO_TO;
            case GO_SUB:
                return StatementRule.GO_SUB;
            case RETURN:
                return StatementRule.RETURN;
            case RESUME:
                return StatementRule.RESUME;
            case EXIT:
                return StatementRule.EXIT;
            case ON:
                return StatementRule.ON;
            case END:
                // End If、End Sub 等出现在这里说明没有对应的块
                return SyntaxEmitter.isLineEnd(second) || second == TokenType.COLON
                        ? StatementRule.END : StatementRule.UNKNOWN;
            case CALL:
                return StatementRule.CALL;
            case RAISE_EVENT:
                return StatementRule.RAISE_EVENT;
            case SET:
                return StatementRule.SET;
            case LET:
                return StatementRule.LET;
            default:
                break;
        }

        LibraryStatement library = LibraryStatement.forKeyword(first);
        if (library != null) {
            if (library.isAssignmentForm()) {
                if (second == TokenType.EQUAL) {
                    return StatementRule.LIBRARY;
                }
            } else if (library == LibraryStatement.LINE_INPUT) {
                if (second == TokenType.INPUT) {
                    return StatementRule.LIBRARY;
                }
            } else if (second != TokenType.EQUAL || !first.isNameLike()) {
                return StatementRule.LIBRARY;
            }
        }

        if (first == TokenType.DOT || first == TokenType.BANG || first == TokenType.ME || first.isNameLike()) {
            return StatementRule.EXPRESSION;
        }
        return StatementRule.UNKNOWN;
    }

    /**
     * 行首的 name: 或行号。
     */
    private boolean isLabelStart(TokenType first) {
        TokenCursor cursor = emitter.cursor();
        if (state.inInlineIf() || !cursor.atLineStart()) {
            return false;
        }
        if (first == TokenType.INTEGER_CONST || first == TokenType.LONG_CONST) {
            return true;
        }
        return first.isNameLike() && cursor.typeAt(cursor.getPosition() + 1) == TokenType.COLON;
    }

    private StatementRule classifyModified() {
        int index = 0;
        while (MODIFIERS.contains(emitter.nth(index))) {
            index++;
        }
        TokenType keyword = emitter.nth(index);
        return switch (keyword) {
            case SUB, FUNCTION -> StatementRule.PROCEDURE;
            case PROPERTY -> isAccessor(emitter.nth(index + 1)) ? StatementRule.PROCEDURE : StatementRule.DIM;
            case DECLARE -> StatementRule.DECLARE;
            case EVENT -> StatementRule.EVENT;
            case ENUM -> StatementRule.ENUM;
            case TYPE -> StatementRule.TYPE;
            case CONST -> StatementRule.CONST;
            default -> StatementRule.DIM;
        };
    }

    private static boolean isAccessor(TokenType type) {
        return type == TokenType.GET || type == TokenType.LET || type == TokenType.SET;
    }

    // ================= 文件头 =================

    private SyntaxKind parseMisplacedHeader(StatementRule rule) {
        emitter.report(DiagnosticKind.HEADER_STATEMENT_OUTSIDE_HEADER,
                "'" + emitter.nthToken(0).lexeme() + "' is only allowed in the file header");
        if (rule == StatementRule.PROPERTIES_BLOCK) {
            // 整个块都放进 UNKNOWN，避免块内的属性行被当成语句
            propertyBlocks.parseBlockContents();
        } else {
            emitter.bumpUntilStatementEnd();
            finishStatement();
        }
        return SyntaxKind.UNKNOWN;
    }

    private SyntaxKind parseFlatLine(SyntaxKind kind) {
        emitter.bumpUntilStatementEnd();
        return kind;
    }

    private SyntaxKind parsePropertiesBlock() {
        propertyBlocks.parseBlockContents();
        return SyntaxKind.PROPERTIES_BLOCK;
    }

    /**
     * Attribute VB_Name = "Form1"，或成员属性 Attribute Value.VB_UserMemId = 0。
     * 成员属性可以出现在任何位置，模块属性只应出现在文件头。
     */
    private SyntaxKind parseAttribute() {
        boolean memberAttribute = emitter.nth(2) == TokenType.DOT;
        if (!memberAttribute && !state.isInHeader()) {
            emitter.report(DiagnosticKind.HEADER_STATEMENT_OUTSIDE_HEADER,
                    "Module attribute after the file header");
        }
        emitter.match(TokenType.ATTRIBUTE);
        if (!expressions.parseTarget()) {
            expected("an attribute name");
        }
        if (emitter.match(TokenType.EQUAL)) {
            do {
                expressions.expectExpression("as attribute value");
            } while (emitter.match(TokenType.COMMA));
        } else {
            expected("'='");
        }
        return SyntaxKind.ATTRIBUTE_STATEMENT;
    }

    // ================= 声明 =================

    private void matchModifiers() {
        while (MODIFIERS.contains(emitter.nth(0))) {
            emitter.skipTrivia();
            emitter.bump();
        }
    }

    private SyntaxKind parseDim() {
        matchModifiers();
        emitter.match(TokenType.DIM);
        do {
            parseVariableDeclaration(true);
        } while (emitter.match(TokenType.COMMA));
        return SyntaxKind.DIM_STATEMENT;
    }

    private void parseVariableDeclaration(boolean allowWithEvents) {
        emitter.skipTrivia();
        emitter.startNode(SyntaxKind.VARIABLE_DECLARATION);
        if (allowWithEvents) {
            emitter.match(TokenType.WITH_EVENTS);
        }
        if (emitter.matchName()) {
            matchTypeSuffix();
        } else {
            expected("a variable name");
        }
        if (emitter.check(TokenType.LPAREN)) {
            parseArrayBounds();
        }
        parseAsClause();
        emitter.finishNode();
    }

    /**
     * ( [下界 To] 上界, ... )；空括号表示动态数组。
     */
    private void parseArrayBounds() {
        emitter.skipTrivia();
        emitter.startNode(SyntaxKind.ARRAY_BOUNDS);
        emitter.bump(); // (
        if (!emitter.check(TokenType.RPAREN)) {
            do {
                emitter.skipTrivia();
                emitter.startNode(SyntaxKind.ARRAY_BOUND);
                expressions.expectExpression("as array bound");
                if (emitter.match(TokenType.TO)) {
                    expressions.expectExpression("after 'To'");
                }
                emitter.finishNode();
            } while (emitter.match(TokenType.COMMA));
        }
        if (!emitter.match(TokenType.RPAREN)) {
            expected("')'");
        }
        emitter.finishNode();
    }

    /**
     * As [New] 类型 [* 长度]
     */
    private void parseAsClause() {
        if (!emitter.check(TokenType.AS)) {
            return;
        }
        emitter.skipTrivia();
        emitter.startNode(SyntaxKind.AS_CLAUSE);
        emitter.bump(); // As
        emitter.match(TokenType.NEW);
        expressions.parseTypeName();
        if (emitter.check(TokenType.LPAREN) && emitter.nth(1) == TokenType.RPAREN) {
            // Function F() As Byte()
            emitter.match(TokenType.LPAREN);
            emitter.match(TokenType.RPAREN);
        }
        if (emitter.match(TokenType.ASTERISK)) {
            expressions.expectExpression("as fixed string length");
        }
        emitter.finishNode();
    }

    /** 名字后面紧贴的类型后缀，如 s$、n% */
    private void matchTypeSuffix() {
        if (TYPE_SUFFIXES.contains(emitter.cursor().peek().type())) {
            emitter.bump();
        }
    }

    private SyntaxKind parseConst() {
        matchModifiers();
        emitter.match(TokenType.CONST);
        do {
            emitter.skipTrivia();
            emitter.startNode(SyntaxKind.CONST_DECLARATION);
            if (emitter.matchName()) {
                matchTypeSuffix();
            } else {
                expected("a constant name");
            }
            parseAsClause();
            if (emitter.match(TokenType.EQUAL)) {
                expressions.expectExpression("as constant value");
            } else {
                expected("'='");
            }
            emitter.finishNode();
        } while (emitter.match(TokenType.COMMA));
        return SyntaxKind.CONST_STATEMENT;
    }

    private SyntaxKind parseReDim() {
        emitter.match(TokenType.RE_DIM);
        emitter.match(TokenType.PRESERVE);
        do {
            parseVariableDeclaration(false);
        } while (emitter.match(TokenType.COMMA));
        return SyntaxKind.RE_DIM_STATEMENT;
    }

    private SyntaxKind parseErase() {
        emitter.match(TokenType.ERASE);
        do {
            expressions.expectExpression("after 'Erase'");
        } while (emitter.match(TokenType.COMMA));
        return SyntaxKind.ERASE_STATEMENT;
    }

    private SyntaxKind parseDeclare() {
        matchModifiers();
        emitter.match(TokenType.DECLARE);
        if (!emitter.matchAny(TokenType.SUB, TokenType.FUNCTION)) {
            expected("'Sub' or 'Function'");
        }
        if (emitter.matchMemberName()) {
            matchTypeSuffix();
        } else {
            expected("a procedure name");
        }
        if (!emitter.match(TokenType.LIB)) {
            expected("'Lib'");
        } else if (!emitter.match(TokenType.STRING_CONST)) {
            expected("a library name");
        }
        if (emitter.match(TokenType.ALIAS) && !emitter.match(TokenType.STRING_CONST)) {
            expected("an alias name");
        }
        if (emitter.check(TokenType.LPAREN)) {
            parseParameterList();
        }
        parseAsClause();
        return SyntaxKind.DECLARE_STATEMENT;
    }

    private SyntaxKind parseEvent() {
        matchModifiers();
        emitter.match(TokenType.EVENT);
        if (!emitter.matchName()) {
            expected("an event name");
        }
        if (emitter.check(TokenType.LPAREN)) {
            parseParameterList();
        }
        return SyntaxKind.EVENT_STATEMENT;
    }

    private SyntaxKind parseImplements() {
        emitter.match(TokenType.IMPLEMENTS);
        expressions.parseTypeName();
        return SyntaxKind.IMPLEMENTS_STATEMENT;
    }

    /**
     * Type ... End Type，每行一个成员。
     */
    private SyntaxKind parseType() {
        matchModifiers();
        emitter.match(TokenType.TYPE);
        if (!emitter.matchName()) {
            expected("a type name");
        }
        finishStatement();
        while (startsMemberLine()) {
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.skipTrivia();
            emitter.bumpAs(SyntaxKind.IDENTIFIER);
            matchTypeSuffix();
            if (emitter.check(TokenType.LPAREN)) {
                parseArrayBounds();
            }
            parseAsClause();
            finishStatement();
            emitter.startNodeAt(checkpoint, SyntaxKind.TYPE_MEMBER);
            emitter.finishNode();
        }
        closeWithEnd(TokenType.TYPE, "End Type");
        return SyntaxKind.TYPE_STATEMENT;
    }

    private SyntaxKind parseEnum() {
        matchModifiers();
        emitter.match(TokenType.ENUM);
        if (!emitter.matchName()) {
            expected("an enum name");
        }
        finishStatement();
        while (startsMemberLine()) {
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.skipTrivia();
            emitter.bumpAs(SyntaxKind.IDENTIFIER);
            if (emitter.match(TokenType.EQUAL)) {
                expressions.expectExpression("as enum value");
            }
            finishStatement();
            emitter.startNodeAt(checkpoint, SyntaxKind.ENUM_MEMBER);
            emitter.finishNode();
        }
        closeWithEnd(TokenType.ENUM, "End Enum");
        return SyntaxKind.ENUM_STATEMENT;
    }

    /**
     * 跳过空行后，下一行是否为 Type/Enum 的成员行。
     * 以非上下文关键字开头的行（包括 End）结束成员列表。
     */
    private boolean startsMemberLine() {
        skipBlankLines();
        return emitter.nth(0).isNameLike();
    }

    // ================= 过程 =================

    private SyntaxKind parseProcedure() {
        matchModifiers();
        SyntaxKind kind;
        BlockContext context;
        if (emitter.match(TokenType.SUB)) {
            kind = SyntaxKind.SUB_STATEMENT;
            context = BlockContext.SUB;
        } else if (emitter.match(TokenType.FUNCTION)) {
            kind = SyntaxKind.FUNCTION_STATEMENT;
            context = BlockContext.FUNCTION;
        } else {
            emitter.match(TokenType.PROPERTY);
            emitter.matchAny(TokenType.GET, TokenType.LET, TokenType.SET);
            kind = SyntaxKind.PROPERTY_STATEMENT;
            context = BlockContext.PROPERTY;
        }
        if (emitter.matchMemberName()) {
            matchTypeSuffix();
        } else {
            expected("a procedure name");
        }
        if (emitter.check(TokenType.LPAREN)) {
            parseParameterList();
        }
        parseAsClause();
        finishStatement();

        parseBody(context);
        TokenType first = emitter.nth(0);
        TokenType second = emitter.nth(1);
        if (BlockContext.isProcedureEnd(first, second)) {
            if (!context.isClosedBy(first, second)) {
                emitter.report(DiagnosticKind.MISMATCHED_BLOCK_TERMINATOR,
                        "Expected '" + context.terminator() + "' but found 'End " + emitter.nthToken(1).lexeme() + "'");
            }
            emitter.match(TokenType.END);
            emitter.skipTrivia();
            emitter.bump();
            finishStatement();
        } else {
            missingTerminator(context.terminator());
        }
        return kind;
    }

    private void parseParameterList() {
        emitter.skipTrivia();
        emitter.startNode(SyntaxKind.PARAMETER_LIST);
        emitter.bump(); // (
        if (!emitter.check(TokenType.RPAREN)) {
            do {
                parseParameter();
            } while (emitter.match(TokenType.COMMA));
        }
        if (!emitter.match(TokenType.RPAREN)) {
            expected("')'");
        }
        emitter.finishNode();
    }

    /**
     * [Optional] [ByVal | ByRef] [ParamArray] 名字[()] [As 类型] [= 默认值]
     */
    private void parseParameter() {
        emitter.skipTrivia();
        emitter.startNode(SyntaxKind.PARAMETER);
        emitter.match(TokenType.OPTIONAL);
        emitter.matchAny(TokenType.BY_VAL, TokenType.BY_REF);
        emitter.match(TokenType.PARAM_ARRAY);
        if (emitter.matchName()) {
            matchTypeSuffix();
        } else {
            expected("a parameter name");
        }
        if (emitter.check(TokenType.LPAREN) && emitter.nth(1) == TokenType.RPAREN) {
            emitter.match(TokenType.LPAREN);
            emitter.match(TokenType.RPAREN);
        }
        parseAsClause();
        if (emitter.match(TokenType.EQUAL)) {
            expressions.expectExpression("as default value");
        }
        emitter.finishNode();
    }

    // ================= 控制流 =================

    /**
     * Then 后面直接换行（或只有注释）时为块状 If，否则为单行 If。
     */
    private SyntaxKind parseIf() {
        emitter.match(TokenType.IF);
        expressions.expectExpression("after 'If'");
        if (!emitter.match(TokenType.THEN)) {
            expected("'Then'");
        }
        if (emitter.atLineEnd() && !state.inInlineIf()) {
            parseBlockIf();
        } else {
            parseInlineIf();
        }
        return SyntaxKind.IF_STATEMENT;
    }

    private void parseBlockIf() {
        finishStatement();
        parseBody(BlockContext.IF);
        while (emitter.check(TokenType.ELSE_IF)) {
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.match(TokenType.ELSE_IF);
            expressions.expectExpression("after 'ElseIf'");
            if (!emitter.match(TokenType.THEN)) {
                expected("'Then'");
            }
            endClauseLine();
            parseBody(BlockContext.IF);
            emitter.startNodeAt(checkpoint, SyntaxKind.ELSE_IF_CLAUSE);
            emitter.finishNode();
        }
        if (emitter.check(TokenType.ELSE)) {
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.match(TokenType.ELSE);
            endClauseLine();
            parseBody(BlockContext.IF);
            emitter.startNodeAt(checkpoint, SyntaxKind.ELSE_CLAUSE);
            emitter.finishNode();
        }
        closeWithEnd(TokenType.IF, BlockContext.IF.terminator());
    }

    /**
     * Else、ElseIf ... Then 行：如果同一行还有语句，留给子语句列表解析。
     */
    private void endClauseLine() {
        if (emitter.atStatementEnd()) {
            finishStatement();
        }
    }

    /**
     * 单行 If：语句直接作为 If 节点的子节点，不包在 STATEMENT_LIST 中。
     */
    private void parseInlineIf() {
        state.enterInlineIf();
        parseStatementList(false);
        if (emitter.check(TokenType.ELSE)) {
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.match(TokenType.ELSE);
            parseStatementList(false);
            emitter.startNodeAt(checkpoint, SyntaxKind.ELSE_CLAUSE);
            emitter.finishNode();
        }
        state.exitInlineIf();
        if (!state.inInlineIf()) {
            emitter.skipTrivia();
            TokenCursor cursor = emitter.cursor();
            if (cursor.peek().type().isComment()) {
                emitter.bump();
            }
            if (cursor.peek().type() == TokenType.NEWLINE) {
                emitter.bump();
            }
        }
    }

    private SyntaxKind parseSelectCase() {
        emitter.match(TokenType.SELECT);
        emitter.match(TokenType.CASE);
        expressions.expectExpression("after 'Select Case'");
        finishStatement();
        skipBlankLines();
        while (emitter.check(TokenType.CASE)) {
            Checkpoint checkpoint = emitter.checkpoint();
            emitter.match(TokenType.CASE);
            SyntaxKind kind;
            if (emitter.match(TokenType.ELSE)) {
                kind = SyntaxKind.CASE_ELSE_CLAUSE;
            } else {
                parseCaseItems();
                kind = SyntaxKind.CASE_CLAUSE;
            }
            endClauseLine();
            parseBody(BlockContext.SELECT);
            emitter.startNodeAt(checkpoint, kind);
            emitter.finishNode();
        }
        closeWithEnd(TokenType.SELECT, BlockContext.SELECT.terminator());
        return SyntaxKind.SELECT_CASE_STATEMENT;
    }

    /**
     * Case 1, 2 To 5, Is > 10
     */
    private void parseCaseItems() {
        do {
            if (emitter.match(TokenType.IS)) {
                if (COMPARISON_OPERATORS.contains(emitter.nth(0))) {
                    emitter.skipTrivia();
                    emitter.bump();
                } else {
                    expected("a comparison operator");
                }
                expressions.expectExpression("after comparison operator");
            } else {
                expressions.expectExpression("after 'Case'");
                if (emitter.match(TokenType.TO)) {
                    expressions.expectExpression("after 'To'");
                }
            }
        } while (emitter.match(TokenType.COMMA));
    }

    private SyntaxKind parseFor() {
        emitter.match(TokenType.FOR);
        boolean forEach = emitter.match(TokenType.EACH);
        if (!expressions.parseTarget()) {
            expected("a loop variable");
        }
        if (forEach) {
            if (!emitter.match(TokenType.IN)) {
                expected("'In'");
            }
            expressions.expectExpression("after 'In'");
        } else {
            if (!emitter.match(TokenType.EQUAL)) {
                expected("'='");
            }
            expressions.expectExpression("as loop start");
            if (!emitter.match(TokenType.TO)) {
                expected("'To'");
            }
            expressions.expectExpression("as loop end");
            if (emitter.match(TokenType.STEP)) {
                expressions.expectExpression("after 'Step'");
            }
        }
        finishStatement();

        BlockContext context = forEach ? BlockContext.FOR_EACH : BlockContext.FOR;
        state.pushBlock(context);
        emitter.startNode(SyntaxKind.STATEMENT_LIST);
        parseStatementList(false);
        emitter.finishNode();
        closeFor();
        state.popBlock();
        return forEach ? SyntaxKind.FOR_EACH_STATEMENT : SyntaxKind.FOR_STATEMENT;
    }

    /**
     * Next [i[, j ...]]。列出多个变量时同时关闭外层的 For，
     * 由外层 For 在这里认领。
     */
    private void closeFor() {
        if (state.takePendingNext()) {
            return;
        }
        if (!emitter.check(TokenType.NEXT)) {
            missingTerminator("Next");
            return;
        }
        emitter.match(TokenType.NEXT);
        if (!emitter.atStatementEnd()) {
            expressions.parseTarget();
            int extra = 0;
            while (emitter.match(TokenType.COMMA)) {
                if (!expressions.parseTarget()) {
                    expected("a loop variable");
                }
                extra++;
            }
            int available = state.enclosingForLoops();
            if (extra > available) {
                emitter.report(DiagnosticKind.UNEXPECTED_TOKEN,
                        "'Next' closes " + (extra + 1) + " loops but only " + (available + 1) + " are open");
            }
            for (int i = 0; i < Math.min(extra, available); i++) {
                state.addPendingNext();
            }
        }
        finishStatement();
    }

    private SyntaxKind parseWhile() {
        emitter.match(TokenType.WHILE);
        expressions.expectExpression("after 'While'");
        finishStatement();
        parseBody(BlockContext.WHILE);
        closeWithKeyword(TokenType.WEND, "Wend");
        return SyntaxKind.WHILE_STATEMENT;
    }

    /**
     * Do [While|Until 条件] ... Loop [While|Until 条件]
     */
    private SyntaxKind parseDo() {
        emitter.match(TokenType.DO);
        if (emitter.matchAny(TokenType.WHILE, TokenType.UNTIL)) {
            expressions.expectExpression("as loop condition");
        }
        finishStatement();
        parseBody(BlockContext.DO);
        if (emitter.match(TokenType.LOOP)) {
            if (emitter.matchAny(TokenType.WHILE, TokenType.UNTIL)) {
                expressions.expectExpression("as loop condition");
            }
            finishStatement();
        } else {
            missingTerminator("Loop");
        }
        return SyntaxKind.DO_STATEMENT;
    }

    private SyntaxKind parseWith() {
        emitter.match(TokenType.WITH);
        expressions.expectExpression("after 'With'");
        finishStatement();
        parseBody(BlockContext.WITH);
        closeWithEnd(TokenType.WITH, BlockContext.WITH.terminator());
        return SyntaxKind.WITH_STATEMENT;
    }

    private SyntaxKind parseJump(SyntaxKind kind) {
        emitter.skipTrivia();
        emitter.bump(); // GoTo / GoSub
        matchLabelReference();
        return kind;
    }

    private void matchLabelReference() {
        if (emitter.nth(0).isNumericLiteral()) {
            emitter.skipTrivia();
            emitter.bump();
        } else if (!emitter.matchName()) {
            expected("a label");
        }
    }

    private SyntaxKind parseKeywordOnly(SyntaxKind kind) {
        emitter.skipTrivia();
        emitter.bump();
        return kind;
    }

    /**
     * Resume、Resume Next、Resume 标签
     */
    private SyntaxKind parseResume() {
        emitter.match(TokenType.RESUME);
        if (!emitter.match(TokenType.NEXT) && !emitter.atStatementEnd()) {
            matchLabelReference();
        }
        return SyntaxKind.RESUME_STATEMENT;
    }

    private SyntaxKind parseExit() {
        emitter.match(TokenType.EXIT);
        if (!emitter.matchAny(TokenType.SUB, TokenType.FUNCTION, TokenType.PROPERTY, TokenType.DO, TokenType.FOR)) {
            expected("'Sub', 'Function', 'Property', 'Do' or 'For'");
        }
        return SyntaxKind.EXIT_STATEMENT;
    }

    /**
     * On [Local] Error GoTo 标签 | On Error Resume Next | On 表达式 GoTo/GoSub 标签, ...
     */
    private SyntaxKind parseOn() {
        emitter.match(TokenType.ON);
        if (emitter.check(TokenType.ERROR)
                || (emitter.check(TokenType.LOCAL) && emitter.nth(1) == TokenType.ERROR)) {
            emitter.match(TokenType.LOCAL);
            emitter.match(TokenType.ERROR);
            if (emitter.match(TokenType.GO_TO)) {
                // On Error GoTo -1
                emitter.match(TokenType.MINUS);
                matchLabelReference();
            } else if (emitter.match(TokenType.RESUME)) {
                if (!emitter.match(TokenType.NEXT)) {
                    expected("'Next'");
                }
            } else {
                expected("'GoTo' or 'Resume'");
            }
            return SyntaxKind.ON_ERROR_STATEMENT;
        }

        expressions.expectExpression("after 'On'");
        SyntaxKind kind = SyntaxKind.ON_GO_TO_STATEMENT;
        if (emitter.match(TokenType.GO_SUB)) {
            kind = SyntaxKind.ON_GO_SUB_STATEMENT;
        } else if (!emitter.match(TokenType.GO_TO)) {
            expected("'GoTo' or 'GoSub'");
            return kind;
        }
        do {
            matchLabelReference();
        } while (emitter.match(TokenType.COMMA));
        return kind;
    }

    // ================= 赋值与调用 =================

    private SyntaxKind parseCall() {
        emitter.match(TokenType.CALL);
        if (!expressions.parseTarget()) {
            expected("a procedure name");
        }
        return SyntaxKind.CALL_STATEMENT;
    }

    private SyntaxKind parseRaiseEvent() {
        emitter.match(TokenType.RAISE_EVENT);
        if (!emitter.matchName()) {
            expected("an event name");
        }
        if (emitter.check(TokenType.LPAREN)) {
            emitter.skipTrivia();
            expressions.parseArgumentList();
        }
        return SyntaxKind.RAISE_EVENT_STATEMENT;
    }

    /**
     * Set 目标 = 表达式、Let 目标 = 表达式
     */
    private SyntaxKind parseKeywordAssignment(SyntaxKind kind) {
        emitter.skipTrivia();
        emitter.bump(); // Set / Let
        if (!expressions.parseTarget()) {
            expected("an assignment target");
        }
        if (emitter.match(TokenType.EQUAL)) {
            expressions.expectExpression("after '='");
        } else {
            expected("'='");
        }
        return kind;
    }

    /**
     * 以名字开头的语句：有 = 时为赋值，否则为省略 Call 的过程调用，
     * 例如 MsgBox "Hi", vbOKOnly 或 obj.Method a, b。
     */
    private SyntaxKind parseExpressionStatement() {
        expressions.parseTarget();
        if (emitter.match(TokenType.EQUAL)) {
            expressions.expectExpression("after '='");
            return SyntaxKind.ASSIGNMENT_STATEMENT;
        }
        if (!emitter.atStatementEnd()) {
            expressions.parseBareArgumentList();
        }
        return SyntaxKind.CALL_STATEMENT;
    }

    private SyntaxKind parseLibraryStatement() {
        LibraryStatement library = LibraryStatement.forKeyword(emitter.nth(0));
        emitter.skipTrivia();
        emitter.bump();
        emitter.bumpUntilStatementEnd();
        return library.kind();
    }

    private SyntaxKind parseLabel() {
        if (emitter.nth(0).isNumericLiteral()) {
            emitter.skipTrivia();
            emitter.bump();
            if (emitter.atStatementEnd()) {
                finishStatement();
            }
        } else {
            emitter.matchName();
            emitter.bump(); // :
            if (emitter.atLineEnd()) {
                finishStatement();
            }
        }
        return SyntaxKind.LABEL_STATEMENT;
    }

    /**
     * 无法识别的语句：至少包含一个 Token，一直到语句结束。
     */
    private SyntaxKind parseUnknown() {
        emitter.report(DiagnosticKind.UNKNOWN_STATEMENT, "Unknown statement starting with " + emitter.describeNext());
        emitter.skipTrivia();
        emitter.bump();
        emitter.bumpUntilStatementEnd();
        return SyntaxKind.UNKNOWN;
    }

    // ================= 块 =================

    /**
     * 块体：压入块上下文后解析 STATEMENT_LIST，块体可以为空。
     */
    private void parseBody(BlockContext context) {
        state.pushBlock(context);
        emitter.startNode(SyntaxKind.STATEMENT_LIST);
        parseStatementList(false);
        emitter.finishNode();
        state.popBlock();
    }

    private void closeWithEnd(TokenType second, String terminator) {
        if (emitter.check(TokenType.END) && emitter.nth(1) == second) {
            emitter.match(TokenType.END);
            emitter.match(second);
            finishStatement();
        } else {
            missingTerminator(terminator);
        }
    }

    private void closeWithKeyword(TokenType keyword, String terminator) {
        if (emitter.match(keyword)) {
            finishStatement();
        } else {
            missingTerminator(terminator);
        }
    }

    private void missingTerminator(String terminator) {
        emitter.report(DiagnosticKind.MISSING_BLOCK_TERMINATOR,
                "Missing '" + terminator + "' before " + emitter.describeNext());
    }

    private void expected(String what) {
        emitter.report(DiagnosticKind.UNEXPECTED_TOKEN, "Expected " + what + " but found " + emitter.describeNext());
    }

    private void skipBlankLines() {
        while (true) {
            TokenType next = emitter.nth(0);
            if (next != TokenType.NEWLINE && !next.isComment()) {
                return;
            }
            emitter.skipTrivia();
            if (next.isComment()) {
                emitter.bump();
            }
            if (emitter.cursor().peek().type() == TokenType.NEWLINE) {
                emitter.bump();
            }
        }
    }
}
