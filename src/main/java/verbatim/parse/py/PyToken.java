package verbatim.parse.py;

import verbatim.ast.SourceSpan;

public record PyToken(PyTokenType type, String lexeme, SourceSpan span) {
	public boolean is(PyTokenType type, String lexeme) {
		return this.type == type && this.lexeme.equals(lexeme);
	}

	public boolean isOp(String lexeme) {
		return is(PyTokenType.OP, lexeme);
	}

	public boolean isName(String lexeme) {
		return is(PyTokenType.NAME, lexeme);
	}
}
