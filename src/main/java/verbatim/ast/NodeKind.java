package verbatim.ast;

/**
 * Closed set of node kinds understood by the indexer and the default formatter.
 */
public enum NodeKind {
	MODULE,
	BLOCK,
	EXPR_STMT,
	ASSIGN,
	AUG_ASSIGN,
	PASS,
	BREAK,
	CONTINUE,
	RETURN,
	RAISE,
	ASSERT,
	IMPORT,
	IMPORT_FROM,
	ALIAS,
	IF,
	ELIF,
	ELSE,
	WHILE,
	FOR,
	TRY,
	EXCEPT_HANDLER,
	FINALLY,
	WITH,
	WITH_ITEM,
	DELETE,
	GLOBAL,
	FUNCTION_DEF,
	PARAMETERS,
	PARAM,
	CLASS_DEF,
	RAW,

	NAME,
	NUMBER,
	STRING,
	BIN_OP,
	BOOL_OP,
	COMPARE,
	COMPARATOR,
	IF_EXP,
	LAMBDA,
	UNARY_OP,
	NOT,
	CALL,
	ARGUMENTS,
	KEYWORD,
	STARRED,
	ATTRIBUTE,
	SUBSCRIPT,
	LIST,
	TUPLE,
	DICT,
	DICT_ENTRY,
	LIST_COMP,
	COMPREHENSION,
	COMP_IF,
	SLICE,
	EMPTY;

	/**
	 * Kinds that may be wrapped in grouping parentheses.
	 */
	public boolean isExpression() {
		return switch (this) {
			case NAME, NUMBER, STRING, BIN_OP, BOOL_OP, COMPARE, IF_EXP, LAMBDA, UNARY_OP, NOT, CALL, ATTRIBUTE,
					SUBSCRIPT, LIST, TUPLE, DICT, LIST_COMP -> true;
			default -> false;
		};
	}

	/**
	 * Statements that end with a block and therefore own no line terminator of their own.
	 */
	public boolean isCompound() {
		return switch (this) {
			case IF, WHILE, FOR, TRY, WITH, FUNCTION_DEF, CLASS_DEF -> true;
			default -> false;
		};
	}

	public boolean isDefinition() {
		return this == FUNCTION_DEF || this == CLASS_DEF;
	}

	/**
	 * Kinds whose rendering depends on the indentation of the line they start on.
	 */
	public boolean isIndented() {
		return switch (this) {
			case MODULE, BLOCK, EXPR_STMT, ASSIGN, AUG_ASSIGN, PASS, BREAK, CONTINUE, RETURN, RAISE, ASSERT, IMPORT,
					IMPORT_FROM, IF, ELIF, ELSE, WHILE, FOR, TRY, EXCEPT_HANDLER, FINALLY, WITH, DELETE, GLOBAL,
					FUNCTION_DEF, CLASS_DEF, RAW -> true;
			default -> false;
		};
	}

	public boolean isStatement() {
		return isIndented() && !isClause() && this != MODULE && this != BLOCK;
	}

	/**
	 * Continuation clauses that start their own line at the owning statement's indentation.
	 */
	public boolean isClause() {
		return this == ELIF || this == ELSE || this == EXCEPT_HANDLER || this == FINALLY;
	}
}
