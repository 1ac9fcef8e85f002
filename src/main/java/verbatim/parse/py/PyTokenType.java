package verbatim.parse.py;

public enum PyTokenType {
	NAME,
	NUMBER,
	STRING,
	OP,
	NEWLINE,
	INDENT,
	DEDENT,
	EOF
}
