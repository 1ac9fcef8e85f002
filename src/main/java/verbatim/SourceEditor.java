package verbatim;

import verbatim.ast.SyntaxNode;
import verbatim.config.FormatConfig;
import verbatim.match.MatchException;
import verbatim.parse.py.PyParser;
import verbatim.print.Reconstructor;
import verbatim.text.SourceText;

/**
 * Public entrypoint: parse a source file, edit the returned tree in place, then ask for the text back.
 *
 * Unchanged regions come back byte for byte; edited regions are re-rendered with default formatting.
 */
public final class SourceEditor {
	private final Reconstructor reconstructor;

	private SourceEditor(Reconstructor reconstructor) {
		this.reconstructor = reconstructor;
	}

	public static SourceEditor open(String source) throws MatchException {
		return open(source, FormatConfig.defaults());
	}

	public static SourceEditor open(String source, FormatConfig config) throws MatchException {
		SyntaxNode module = new PyParser().parse(source);
		return new SourceEditor(Reconstructor.index(module, SourceText.of(source), config));
	}

	public SyntaxNode root() {
		return reconstructor.root();
	}

	public String getSource() {
		return reconstructor.getSource();
	}

	public String getSource(SyntaxNode node) {
		return reconstructor.getSource(node);
	}

	public Reconstructor reconstructor() {
		return reconstructor;
	}
}
