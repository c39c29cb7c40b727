/*******************************************************************************
 * PhyloTree - Phylogenetic trees and Newick processing
 * Copyright 2026 PhyloTree contributors
 *
 * This file is part of PhyloTree.
 *
 *     PhyloTree is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     PhyloTree is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with PhyloTree.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package phylotree.main.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reports the lexical errors found by a {@link Lexer}. The scan does not stop at the first
 * error, so all the error tokens of the analyzed text are available through {@link #getErrors()}.
 * The line and column reported are the ones of the first error.
 * @author PhyloTree contributors
 */
public class LexerException extends TextFormatException {

	private static final long serialVersionUID = 1L;
	private final String text;
	private final List<LexerToken> errors;

	public LexerException(List<LexerToken> errors) {
		super(buildMessage(errors), errors.get(0).getLine(), errors.get(0).getColumn());
		this.text = errors.get(0).getText();
		this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
	}

	private static String buildMessage(List<LexerToken> errors) {
		LexerToken first = errors.get(0);
		String message = first.getValue()+" '"+first.getText()+"'";
		if(errors.size()>1) message+=" (plus "+(errors.size()-1)+" more lexical errors)";
		return message;
	}

	/**
	 * @return Literal text of the first offending token
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return List with all the error tokens produced by the scan
	 */
	public List<LexerToken> getErrors() {
		return errors;
	}
}
