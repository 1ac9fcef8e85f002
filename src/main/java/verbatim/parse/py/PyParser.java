package verbatim.parse.py;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import verbatim.ast.NodeKind;
import verbatim.ast.SyntaxNode;
import verbatim.print.Precedence;

import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the modelled subset of the language.
 *
 * A statement that uses anything outside the subset is kept whole as a {@link NodeKind#RAW}
 * statement holding its exact source text, so every input the lexer accepts yields a tree.
 */
public final class PyParser {
	private static final Logger log = LoggerFactory.getLogger(PyParser.class);

	private static final Set<String> KEYWORDS = Set.of(
			"and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else",
			"except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
			"or", "pass", "raise", "return", "try", "while", "with", "yield");

	private static final Set<String> CLAUSE_KEYWORDS = Set.of("elif", "else", "except", "finally");

	private static final Set<String> COMPARISON_OPS = Set.of("<", ">", "==", ">=", "<=", "!=");

	private static final List<Set<String>> BINARY_LEVELS = List.of(
			Set.of("|"),
			Set.of("^"),
			Set.of("&"),
			Set.of("<<", ">>"),
			Set.of("+", "-"),
			Set.of("*", "/", "//", "%", "@"));

	public SyntaxNode parse(String source) {
		Cursor c = new Cursor(new PyLexer().lex(source), source);
		SyntaxNode module = new SyntaxNode(NodeKind.MODULE);
		while (!c.isAtEnd()) {
			module.add(statement(c));
		}
		return module;
	}

	/**
	 * Parses a single expression (a bare tuple is allowed) spanning the whole input.
	 */
	public SyntaxNode parseExpression(String source) {
		Cursor c = new Cursor(new PyLexer().lex(source), source);
		SyntaxNode expression = exprList(c);
		c.expect(PyTokenType.NEWLINE, "end of expression");
		if (!c.isAtEnd()) {
			throw c.unsupported("trailing input");
		}
		return expression;
	}

	private SyntaxNode statement(Cursor c) {
		PyToken first = c.peek();
		if (first.type() == PyTokenType.INDENT || first.type() == PyTokenType.DEDENT) {
			throw new IllegalArgumentException("Unexpected indentation at offset " + first.span().startOffset());
		}
		int mark = c.mark();
		try {
			return modelledStatement(c);
		} catch (IllegalArgumentException e) {
			c.reset(mark);
			log.debug("Keeping statement at offset {} as raw text: {}", first.span().startOffset(), e.getMessage());
			return rawStatement(c);
		}
	}

	private SyntaxNode modelledStatement(Cursor c) {
		PyToken t = c.peek();
		if (t.type() == PyTokenType.NAME) {
			switch (t.lexeme()) {
				case "if":
					return ifStatement(c, NodeKind.IF);
				case "while":
					return whileStatement(c);
				case "for":
					return forStatement(c);
				case "try":
					return tryStatement(c);
				case "with":
					return withStatement(c);
				case "def":
					return functionDef(c);
				case "class":
					return classDef(c);
				default:
					break;
			}
		}
		SyntaxNode statement = simpleStatement(c);
		c.expect(PyTokenType.NEWLINE, "end of statement");
		return statement;
	}

	private SyntaxNode simpleStatement(Cursor c) {
		PyToken t = c.peek();
		if (t.type() == PyTokenType.NAME) {
			switch (t.lexeme()) {
				case "pass":
					c.next();
					return new SyntaxNode(NodeKind.PASS);
				case "break":
					c.next();
					return new SyntaxNode(NodeKind.BREAK);
				case "continue":
					c.next();
					return new SyntaxNode(NodeKind.CONTINUE);
				case "return":
					c.next();
					if (c.peek().type() == PyTokenType.NEWLINE) {
						return new SyntaxNode(NodeKind.RETURN);
					}
					return node(NodeKind.RETURN, null, exprList(c));
				case "raise":
					c.next();
					if (c.peek().type() == PyTokenType.NEWLINE) {
						return new SyntaxNode(NodeKind.RAISE);
					}
					return node(NodeKind.RAISE, null, test(c));
				case "assert": {
					c.next();
					SyntaxNode assertion = node(NodeKind.ASSERT, null, test(c));
					if (c.peek().isOp(",")) {
						c.next();
						assertion.add(test(c));
					}
					return assertion;
				}
				case "del": {
					c.next();
					SyntaxNode statement = node(NodeKind.DELETE, null, orExpr(c));
					while (c.skipOp(",")) {
						if (c.peek().type() == PyTokenType.NEWLINE) {
							throw c.unsupported("trailing comma");
						}
						statement.add(orExpr(c));
					}
					return statement;
				}
				case "global": {
					c.next();
					SyntaxNode statement = new SyntaxNode(NodeKind.GLOBAL);
					do {
						statement.add(new SyntaxNode(NodeKind.NAME, c.expect(PyTokenType.NAME, "name").lexeme()));
					} while (c.skipOp(","));
					return statement;
				}
				case "import":
					return importStatement(c);
				case "from":
					return fromStatement(c);
				default:
					break;
			}
		}

		SyntaxNode first = exprList(c);
		PyToken next = c.peek();
		if (next.isOp("=")) {
			c.next();
			SyntaxNode value = exprList(c);
			if (c.peek().isOp("=")) {
				throw c.unsupported("chained assignment");
			}
			return node(NodeKind.ASSIGN, null, first, value);
		}
		if (next.type() == PyTokenType.OP && Precedence.isAugmentedAssignment(next.lexeme())) {
			c.next();
			return node(NodeKind.AUG_ASSIGN, next.lexeme(), first, exprList(c));
		}
		return node(NodeKind.EXPR_STMT, null, first);
	}

	private SyntaxNode ifStatement(Cursor c, NodeKind kind) {
		c.next();
		SyntaxNode test = test(c);
		SyntaxNode statement = node(kind, null, test, block(c));
		if (c.peek().isName("elif")) {
			statement.add(ifStatement(c, NodeKind.ELIF));
		} else if (c.peek().isName("else")) {
			c.next();
			statement.add(node(NodeKind.ELSE, null, block(c)));
		}
		return statement;
	}

	private SyntaxNode whileStatement(Cursor c) {
		c.next();
		SyntaxNode test = test(c);
		SyntaxNode statement = node(NodeKind.WHILE, null, test, block(c));
		if (c.peek().isName("else")) {
			throw c.unsupported("while-else");
		}
		return statement;
	}

	private SyntaxNode forStatement(Cursor c) {
		c.next();
		SyntaxNode target = targetList(c);
		c.expectName("in");
		SyntaxNode iterable = exprList(c);
		SyntaxNode statement = node(NodeKind.FOR, null, target, iterable, block(c));
		if (c.peek().isName("else")) {
			throw c.unsupported("for-else");
		}
		return statement;
	}

	private SyntaxNode tryStatement(Cursor c) {
		c.next();
		SyntaxNode statement = node(NodeKind.TRY, null, block(c));
		while (c.peek().isName("except")) {
			statement.add(exceptHandler(c));
		}
		boolean handled = statement.childCount() > 1;
		if (handled && c.peek().isName("else")) {
			c.next();
			statement.add(node(NodeKind.ELSE, null, block(c)));
		}
		if (c.peek().isName("finally")) {
			c.next();
			statement.add(node(NodeKind.FINALLY, null, block(c)));
		} else if (!handled) {
			throw c.unsupported("try without except or finally");
		}
		return statement;
	}

	private SyntaxNode exceptHandler(Cursor c) {
		c.next();
		SyntaxNode handler = new SyntaxNode(NodeKind.EXCEPT_HANDLER);
		if (!c.peek().isOp(":")) {
			handler.add(test(c));
			if (c.peek().isName("as")) {
				c.next();
				handler.add(new SyntaxNode(NodeKind.NAME, c.expect(PyTokenType.NAME, "exception name").lexeme()));
			}
		}
		handler.add(block(c));
		return handler;
	}

	private SyntaxNode withStatement(Cursor c) {
		c.next();
		SyntaxNode statement = new SyntaxNode(NodeKind.WITH);
		do {
			SyntaxNode item = node(NodeKind.WITH_ITEM, null, test(c));
			if (c.peek().isName("as")) {
				c.next();
				item.add(orExpr(c));
			}
			statement.add(item);
		} while (c.skipOp(","));
		statement.add(block(c));
		return statement;
	}

	private SyntaxNode functionDef(Cursor c) {
		c.next();
		PyToken name = c.expect(PyTokenType.NAME, "function name");
		SyntaxNode parameters = parameters(c);
		return node(NodeKind.FUNCTION_DEF, name.lexeme(), parameters, block(c));
	}

	private SyntaxNode classDef(Cursor c) {
		c.next();
		PyToken name = c.expect(PyTokenType.NAME, "class name");
		SyntaxNode classDef = new SyntaxNode(NodeKind.CLASS_DEF, name.lexeme());
		if (c.peek().isOp("(")) {
			classDef.add(arguments(c));
		}
		classDef.add(block(c));
		return classDef;
	}

	private SyntaxNode block(Cursor c) {
		c.expectOp(":");
		if (c.peek().type() != PyTokenType.NEWLINE) {
			throw c.unsupported("block on the header line");
		}
		c.next();
		c.expect(PyTokenType.INDENT, "indented block");
		SyntaxNode block = new SyntaxNode(NodeKind.BLOCK);
		while (c.peek().type() != PyTokenType.DEDENT && !c.isAtEnd()) {
			block.add(statement(c));
		}
		c.expect(PyTokenType.DEDENT, "end of block");
		return block;
	}

	private SyntaxNode importStatement(Cursor c) {
		c.next();
		SyntaxNode statement = new SyntaxNode(NodeKind.IMPORT);
		do {
			PyToken first = c.expect(PyTokenType.NAME, "module name");
			PyToken last = first;
			while (c.peek().isOp(".")) {
				c.next();
				last = c.expect(PyTokenType.NAME, "module name");
			}
			statement.add(alias(c, c.slice(first, last)));
		} while (c.skipOp(","));
		return statement;
	}

	private SyntaxNode fromStatement(Cursor c) {
		c.next();
		PyToken first = c.peek();
		PyToken last = null;
		while (c.peek().isOp(".") || c.peek().isOp("...")
				|| (c.peek().type() == PyTokenType.NAME && !c.peek().isName("import"))) {
			last = c.next();
		}
		if (last == null) {
			throw c.unsupported("module name");
		}
		c.expectName("import");
		SyntaxNode statement = new SyntaxNode(NodeKind.IMPORT_FROM, c.slice(first, last));
		if (c.peek().isOp("*")) {
			c.next();
			statement.add(new SyntaxNode(NodeKind.ALIAS, "*"));
			return statement;
		}
		do {
			PyToken name = c.expect(PyTokenType.NAME, "imported name");
			statement.add(alias(c, name.lexeme()));
		} while (c.skipOp(","));
		return statement;
	}

	private SyntaxNode alias(Cursor c, String name) {
		SyntaxNode alias = new SyntaxNode(NodeKind.ALIAS, name);
		if (c.peek().isName("as")) {
			c.next();
			alias.add(new SyntaxNode(NodeKind.NAME, c.expect(PyTokenType.NAME, "alias").lexeme()));
		}
		return alias;
	}

	/**
	 * Skips one statement, including its nested blocks and continuation clauses, and keeps its text.
	 */
	private SyntaxNode rawStatement(Cursor c) {
		PyToken first = c.peek();
		PyToken last = first;
		while (true) {
			boolean decorator = c.peek().isOp("@");
			while (c.peek().type() != PyTokenType.NEWLINE && !c.isAtEnd()) {
				last = c.next();
			}
			if (c.peek().type() == PyTokenType.NEWLINE) {
				c.next();
			}
			if (c.peek().type() == PyTokenType.INDENT) {
				c.next();
				int open = 1;
				while (open > 0 && !c.isAtEnd()) {
					PyToken t = c.next();
					if (t.type() == PyTokenType.INDENT) {
						open++;
					} else if (t.type() == PyTokenType.DEDENT) {
						open--;
					} else if (t.type() != PyTokenType.NEWLINE) {
						last = t;
					}
				}
			}
			PyToken following = c.peek();
			boolean clause = following.type() == PyTokenType.NAME && CLAUSE_KEYWORDS.contains(following.lexeme());
			if (!decorator && !clause) {
				break;
			}
		}
		return new SyntaxNode(NodeKind.RAW, c.slice(first, last));
	}

	// expressions

	private SyntaxNode exprList(Cursor c) {
		SyntaxNode first = starOrTest(c);
		if (!c.peek().isOp(",")) {
			return first;
		}
		SyntaxNode tuple = node(NodeKind.TUPLE, null, first);
		while (c.peek().isOp(",")) {
			c.next();
			if (endsTuple(c.peek())) {
				break;
			}
			tuple.add(starOrTest(c));
		}
		return tuple;
	}

	private SyntaxNode targetList(Cursor c) {
		SyntaxNode first = starOr(c, false);
		if (!c.peek().isOp(",")) {
			return first;
		}
		SyntaxNode tuple = node(NodeKind.TUPLE, null, first);
		while (c.peek().isOp(",")) {
			c.next();
			if (c.peek().isName("in")) {
				break;
			}
			tuple.add(starOr(c, false));
		}
		return tuple;
	}

	private static boolean endsTuple(PyToken t) {
		if (t.type() == PyTokenType.NEWLINE || t.type() == PyTokenType.EOF) {
			return true;
		}
		if (t.type() != PyTokenType.OP) {
			return false;
		}
		return t.lexeme().equals("=") || t.lexeme().equals(")") || t.lexeme().equals("]") || t.lexeme().equals("}")
				|| t.lexeme().equals(":") || Precedence.isAugmentedAssignment(t.lexeme());
	}

	private SyntaxNode starOrTest(Cursor c) {
		return starOr(c, true);
	}

	private SyntaxNode starOr(Cursor c, boolean fullTest) {
		if (c.peek().isOp("*")) {
			c.next();
			return node(NodeKind.STARRED, "*", orExpr(c));
		}
		return fullTest ? test(c) : orExpr(c);
	}

	private SyntaxNode test(Cursor c) {
		if (c.peek().isName("lambda")) {
			return lambda(c);
		}
		SyntaxNode expression = orTest(c);
		if (!c.peek().isName("if")) {
			return expression;
		}
		c.next();
		SyntaxNode condition = orTest(c);
		c.expectName("else");
		return node(NodeKind.IF_EXP, null, expression, condition, test(c));
	}

	private SyntaxNode lambda(Cursor c) {
		c.next();
		SyntaxNode lambda = new SyntaxNode(NodeKind.LAMBDA);
		while (!c.peek().isOp(":")) {
			lambda.add(parameter(c, true));
			if (!c.skipOp(",")) {
				break;
			}
			if (c.peek().isOp(":")) {
				throw c.unsupported("trailing comma");
			}
		}
		c.expectOp(":");
		lambda.add(test(c));
		return lambda;
	}

	private SyntaxNode orTest(Cursor c) {
		SyntaxNode left = andTest(c);
		while (c.peek().isName("or")) {
			c.next();
			left = node(NodeKind.BOOL_OP, "or", left, andTest(c));
		}
		return left;
	}

	private SyntaxNode andTest(Cursor c) {
		SyntaxNode left = notTest(c);
		while (c.peek().isName("and")) {
			c.next();
			left = node(NodeKind.BOOL_OP, "and", left, notTest(c));
		}
		return left;
	}

	private SyntaxNode notTest(Cursor c) {
		if (c.peek().isName("not")) {
			c.next();
			return node(NodeKind.NOT, null, notTest(c));
		}
		return comparison(c);
	}

	private SyntaxNode comparison(Cursor c) {
		SyntaxNode left = orExpr(c);
		if (!atComparison(c)) {
			return left;
		}
		SyntaxNode compare = node(NodeKind.COMPARE, null, left);
		while (atComparison(c)) {
			String op = comparisonOperator(c);
			compare.add(node(NodeKind.COMPARATOR, op, orExpr(c)));
		}
		return compare;
	}

	private static boolean atComparison(Cursor c) {
		PyToken t = c.peek();
		return (t.type() == PyTokenType.OP && COMPARISON_OPS.contains(t.lexeme()))
				|| t.isName("in") || t.isName("is")
				|| (t.isName("not") && c.peekAt(1).isName("in"));
	}

	private static String comparisonOperator(Cursor c) {
		PyToken t = c.next();
		if (t.isName("is") && c.peek().isName("not")) {
			c.next();
			return "is not";
		}
		if (t.isName("not")) {
			c.next();
			return "not in";
		}
		return t.lexeme();
	}

	private SyntaxNode orExpr(Cursor c) {
		return binary(c, 0);
	}

	private SyntaxNode binary(Cursor c, int level) {
		if (level == BINARY_LEVELS.size()) {
			return factor(c);
		}
		SyntaxNode left = binary(c, level + 1);
		while (c.peek().type() == PyTokenType.OP && BINARY_LEVELS.get(level).contains(c.peek().lexeme())) {
			String op = c.next().lexeme();
			left = node(NodeKind.BIN_OP, op, left, binary(c, level + 1));
		}
		return left;
	}

	private SyntaxNode factor(Cursor c) {
		PyToken t = c.peek();
		if (t.isOp("-") || t.isOp("+") || t.isOp("~")) {
			c.next();
			return node(NodeKind.UNARY_OP, t.lexeme(), factor(c));
		}
		return power(c);
	}

	private SyntaxNode power(Cursor c) {
		SyntaxNode base = atomExpr(c);
		if (c.peek().isOp("**")) {
			c.next();
			return node(NodeKind.BIN_OP, "**", base, factor(c));
		}
		return base;
	}

	private SyntaxNode atomExpr(Cursor c) {
		SyntaxNode expression = atom(c);
		while (true) {
			if (c.peek().isOp("(")) {
				expression = node(NodeKind.CALL, null, expression, arguments(c));
			} else if (c.peek().isOp("[")) {
				c.next();
				SyntaxNode index = subscriptIndex(c);
				c.expectOp("]");
				expression = node(NodeKind.SUBSCRIPT, null, expression, index);
			} else if (c.peek().isOp(".")) {
				c.next();
				PyToken name = c.expect(PyTokenType.NAME, "attribute name");
				expression = node(NodeKind.ATTRIBUTE, name.lexeme(), expression);
			} else {
				return expression;
			}
		}
	}

	/**
	 * Index of a subscript: an expression list, or a single slice.
	 */
	private SyntaxNode subscriptIndex(Cursor c) {
		if (c.peek().isOp("*")) {
			return exprList(c);
		}
		int mark = c.mark();
		SyntaxNode lower;
		if (c.peek().isOp(":")) {
			lower = new SyntaxNode(NodeKind.EMPTY);
		} else {
			lower = sliceBound(c);
			if (!c.peek().isOp(":")) {
				c.reset(mark);
				return exprList(c);
			}
		}
		c.expectOp(":");
		SyntaxNode slice = node(NodeKind.SLICE, null, lower, atSliceEnd(c) ? new SyntaxNode(NodeKind.EMPTY) : sliceBound(c));
		if (c.skipOp(":")) {
			slice.add(atSliceEnd(c) ? new SyntaxNode(NodeKind.EMPTY) : sliceBound(c));
		}
		if (c.peek().isOp(",")) {
			throw c.unsupported("extended slice");
		}
		return slice;
	}

	private SyntaxNode sliceBound(Cursor c) {
		if (c.peek().isName("lambda")) {
			throw c.unsupported("lambda slice bound");
		}
		return test(c);
	}

	private static boolean atSliceEnd(Cursor c) {
		return c.peek().isOp("]") || c.peek().isOp(":") || c.peek().isOp(",");
	}

	private SyntaxNode comprehension(Cursor c) {
		c.expectName("for");
		SyntaxNode target = targetList(c);
		c.expectName("in");
		SyntaxNode comprehension = node(NodeKind.COMPREHENSION, null, target, orTest(c));
		while (c.peek().isName("if")) {
			c.next();
			comprehension.add(node(NodeKind.COMP_IF, null, orTest(c)));
		}
		return comprehension;
	}

	private SyntaxNode atom(Cursor c) {
		PyToken t = c.peek();
		if (t.isOp("(")) {
			c.next();
			if (c.skipOp(")")) {
				return new SyntaxNode(NodeKind.TUPLE);
			}
			SyntaxNode first = starOrTest(c);
			if (c.skipOp(")")) {
				return first;
			}
			if (!c.peek().isOp(",")) {
				throw c.unsupported("parenthesized expression");
			}
			SyntaxNode tuple = node(NodeKind.TUPLE, null, first);
			while (c.skipOp(",")) {
				if (c.peek().isOp(")")) {
					break;
				}
				tuple.add(starOrTest(c));
			}
			c.expectOp(")");
			return tuple;
		}
		if (t.isOp("[")) {
			c.next();
			SyntaxNode list = new SyntaxNode(NodeKind.LIST);
			while (!c.peek().isOp("]")) {
				SyntaxNode item = starOrTest(c);
				if (list.childCount() == 0 && c.peek().isName("for")) {
					SyntaxNode listComp = node(NodeKind.LIST_COMP, null, item);
					while (c.peek().isName("for")) {
						listComp.add(comprehension(c));
					}
					c.expectOp("]");
					return listComp;
				}
				list.add(item);
				if (!c.skipOp(",")) {
					break;
				}
			}
			c.expectOp("]");
			return list;
		}
		if (t.isOp("{")) {
			c.next();
			SyntaxNode dict = new SyntaxNode(NodeKind.DICT);
			while (!c.peek().isOp("}")) {
				SyntaxNode key = test(c);
				if (!c.peek().isOp(":")) {
					throw c.unsupported("set display");
				}
				c.next();
				dict.add(node(NodeKind.DICT_ENTRY, null, key, test(c)));
				if (!c.skipOp(",")) {
					break;
				}
			}
			c.expectOp("}");
			return dict;
		}
		if (t.type() == PyTokenType.NAME) {
			if (KEYWORDS.contains(t.lexeme())) {
				throw c.unsupported("'" + t.lexeme() + "'");
			}
			c.next();
			return new SyntaxNode(NodeKind.NAME, t.lexeme());
		}
		if (t.type() == PyTokenType.NUMBER) {
			c.next();
			return new SyntaxNode(NodeKind.NUMBER, t.lexeme());
		}
		if (t.type() == PyTokenType.STRING) {
			c.next();
			if (c.peek().type() == PyTokenType.STRING) {
				throw c.unsupported("implicit string concatenation");
			}
			return new SyntaxNode(NodeKind.STRING, stringContent(t.lexeme()));
		}
		throw c.unsupported("unexpected " + t.type() + " '" + t.lexeme() + "'");
	}

	private SyntaxNode arguments(Cursor c) {
		c.expectOp("(");
		SyntaxNode arguments = new SyntaxNode(NodeKind.ARGUMENTS);
		while (!c.peek().isOp(")")) {
			PyToken t = c.peek();
			if (t.isOp("*") || t.isOp("**")) {
				c.next();
				arguments.add(node(NodeKind.STARRED, t.lexeme(), orTest(c)));
			} else if (t.type() == PyTokenType.NAME && c.peekAt(1).isOp("=")) {
				c.next();
				c.next();
				arguments.add(node(NodeKind.KEYWORD, t.lexeme(), test(c)));
			} else {
				arguments.add(test(c));
			}
			if (!c.skipOp(",")) {
				break;
			}
		}
		c.expectOp(")");
		return arguments;
	}

	private SyntaxNode parameters(Cursor c) {
		c.expectOp("(");
		SyntaxNode parameters = new SyntaxNode(NodeKind.PARAMETERS);
		while (!c.peek().isOp(")")) {
			parameters.add(parameter(c, false));
			if (!c.skipOp(",")) {
				break;
			}
		}
		c.expectOp(")");
		return parameters;
	}

	private SyntaxNode parameter(Cursor c, boolean inLambda) {
		PyToken start = c.peek();
		String name;
		if (start.isOp("/")) {
			c.next();
			return new SyntaxNode(NodeKind.PARAM, "/");
		}
		if (start.isOp("*") || start.isOp("**")) {
			c.next();
			if (start.isOp("*") && (c.peek().isOp(",") || c.peek().isOp(")") || c.peek().isOp(":"))) {
				return new SyntaxNode(NodeKind.PARAM, "*");
			}
			PyToken id = c.expect(PyTokenType.NAME, "parameter name");
			name = c.slice(start, id);
		} else {
			name = c.expect(PyTokenType.NAME, "parameter name").lexeme();
		}
		if (!inLambda && c.peek().isOp(":")) {
			throw c.unsupported("parameter annotation");
		}
		SyntaxNode parameter = new SyntaxNode(NodeKind.PARAM, name);
		if (c.skipOp("=")) {
			parameter.add(test(c));
		}
		return parameter;
	}

	static String stringContent(String lexeme) {
		int p = 0;
		while (Character.isLetter(lexeme.charAt(p))) {
			p++;
		}
		char q = lexeme.charAt(p);
		int quoteLength = lexeme.startsWith(String.valueOf(q).repeat(3), p) && lexeme.length() - p >= 6 ? 3 : 1;
		return lexeme.substring(p + quoteLength, lexeme.length() - quoteLength);
	}

	private static SyntaxNode node(NodeKind kind, String value, SyntaxNode... children) {
		return new SyntaxNode(kind, value, List.of(children));
	}

	private static final class Cursor {
		private final List<PyToken> tokens;
		private final String source;
		private int pos;

		Cursor(List<PyToken> tokens, String source) {
			this.tokens = tokens;
			this.source = source;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == PyTokenType.EOF;
		}

		PyToken peek() {
			return tokens.get(pos);
		}

		PyToken peekAt(int ahead) {
			return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
		}

		PyToken next() {
			PyToken t = tokens.get(pos);
			if (t.type() != PyTokenType.EOF) {
				pos++;
			}
			return t;
		}

		int mark() {
			return pos;
		}

		void reset(int mark) {
			pos = mark;
		}

		boolean skipOp(String lexeme) {
			if (peek().isOp(lexeme)) {
				pos++;
				return true;
			}
			return false;
		}

		String slice(PyToken first, PyToken last) {
			return source.substring(first.span().startOffset(), last.span().endOffset());
		}

		PyToken expectOp(String lexeme) {
			PyToken t = expect(PyTokenType.OP, "'" + lexeme + "'");
			if (!t.lexeme().equals(lexeme)) {
				throw new IllegalArgumentException("Expected " + lexeme + " but got " + t.lexeme()
						+ " at offset " + t.span().startOffset());
			}
			return t;
		}

		PyToken expectName(String lexeme) {
			PyToken t = expect(PyTokenType.NAME, "'" + lexeme + "'");
			if (!t.lexeme().equals(lexeme)) {
				throw new IllegalArgumentException("Expected " + lexeme + " but got " + t.lexeme()
						+ " at offset " + t.span().startOffset());
			}
			return t;
		}

		PyToken expect(PyTokenType type, String what) {
			PyToken t = next();
			if (t.type() != type) {
				throw new IllegalArgumentException("Expected " + what + " but got " + t.type() + "(" + t.lexeme() + ")"
						+ " at offset " + t.span().startOffset());
			}
			return t;
		}

		IllegalArgumentException unsupported(String what) {
			return new IllegalArgumentException("Unsupported " + what + " at offset " + peek().span().startOffset());
		}
	}
}
