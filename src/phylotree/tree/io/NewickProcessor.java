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
package phylotree.tree.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

import phylotree.main.io.LexerToken;
import phylotree.main.io.ParseUtils;
import phylotree.main.io.TextFormatException;
import phylotree.tree.Tree;
import phylotree.tree.TreeCollection;

/**
 * Reads and writes trees in Newick format. Parsing runs the lexer, the bracket validation, the parser
 * and the construction of the tree. Printing flattens the tree into a broker and writes the broker elements
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node payloads
 * @param <E> Type of the edge payloads
 */
public class NewickProcessor<N extends NewickPayload, E extends NewickPayload> {
	
	public static final String DEF_TREE_NAME_PREFIX = "tree_";
	public static final boolean DEF_PRINT_NAMES = true;
	public static final boolean DEF_PRINT_BRANCH_LENGTHS = true;
	public static final boolean DEF_PRINT_COMMENTS = false;
	public static final boolean DEF_PRINT_TAGS = false;
	public static final int DEF_PRECISION = ParseUtils.EXACT_PRECISION;
	
	private Logger log = Logger.getLogger(NewickProcessor.class.getName());
	
	private final NewickPayloadFactory<N> nodeDataFactory;
	private final NewickPayloadFactory<E> edgeDataFactory;
	private final NewickLexer lexer = new NewickLexer();
	private final NewickParser parser = new NewickParser();
	
	private boolean printNames = DEF_PRINT_NAMES;
	private boolean printBranchLengths = DEF_PRINT_BRANCH_LENGTHS;
	private boolean printComments = DEF_PRINT_COMMENTS;
	private boolean printTags = DEF_PRINT_TAGS;
	private int precision = DEF_PRECISION;
	
	public NewickProcessor(NewickPayloadFactory<N> nodeDataFactory, NewickPayloadFactory<E> edgeDataFactory) {
		if(nodeDataFactory==null) throw new NullPointerException("Node data factory can not be null");
		if(edgeDataFactory==null) throw new NullPointerException("Edge data factory can not be null");
		this.nodeDataFactory = nodeDataFactory;
		this.edgeDataFactory = edgeDataFactory;
	}
	
	/**
	 * @return NewickProcessor for trees with names in the nodes and branch lengths in the edges
	 */
	public static NewickProcessor<DefaultNodeData, DefaultEdgeData> createDefault() {
		return new NewickProcessor<>(DefaultNodeData.FACTORY, DefaultEdgeData.FACTORY);
	}
	
	public Logger getLog() {
		return log;
	}
	
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}
	
	/**
	 * @return NewickLexer Lexer used to tokenize texts. Changes to its configuration affect the next parse
	 */
	public NewickLexer getLexer() {
		return lexer;
	}
	
	public boolean isReadComments() {
		return parser.isReadComments();
	}
	
	public void setReadComments(boolean readComments) {
		parser.setReadComments(readComments);
	}
	
	public boolean isReadTags() {
		return parser.isReadTags();
	}
	
	public void setReadTags(boolean readTags) {
		parser.setReadTags(readTags);
	}
	
	public boolean isPrintNames() {
		return printNames;
	}
	
	public void setPrintNames(boolean printNames) {
		this.printNames = printNames;
	}
	
	public boolean isPrintBranchLengths() {
		return printBranchLengths;
	}
	
	public void setPrintBranchLengths(boolean printBranchLengths) {
		this.printBranchLengths = printBranchLengths;
	}
	
	public boolean isPrintComments() {
		return printComments;
	}
	
	public void setPrintComments(boolean printComments) {
		this.printComments = printComments;
	}
	
	public boolean isPrintTags() {
		return printTags;
	}
	
	public void setPrintTags(boolean printTags) {
		this.printTags = printTags;
	}
	
	public int getPrecision() {
		return precision;
	}
	
	public void setPrecision(int precision) {
		if(precision<ParseUtils.EXACT_PRECISION) throw new IllegalArgumentException("Invalid precision: "+precision+". Use a number of decimal places or "+ParseUtils.EXACT_PRECISION+" to keep every digit");
		this.precision = precision;
	}
	
	/**
	 * Parses a text with exactly one tree
	 * @param text Newick text terminated by semicolon
	 * @return Tree<N,E> new tree
	 * @throws TextFormatException LexerException, BracketMismatchException or MalformedNewickException
	 * if the text is not a valid Newick tree
	 */
	public Tree<N,E> parse(String text) throws TextFormatException {
		List<LexerToken> tokens = tokenize(text);
		NewickBroker broker = parser.parse(tokens);
		return buildTree(broker);
	}
	
	/**
	 * Parses a text with zero or more trees, optionally named with the syntax name = tree;
	 * @param text Newick text
	 * @return TreeCollection<N,E> Trees in the order of the text. Unnamed trees are named tree_k where k is the 1-based position
	 * @throws TextFormatException If the text is not a valid Newick text or if two trees have the same name
	 */
	public TreeCollection<N,E> parseCollection(String text) throws TextFormatException {
		List<LexerToken> tokens = tokenize(text);
		List<NewickBroker> brokers = parser.parseTrees(tokens);
		TreeCollection<N,E> answer = new TreeCollection<>();
		for(int i=0;i<brokers.size();i++) {
			NewickBroker broker = brokers.get(i);
			String name = broker.getTreeName();
			if(name==null) name = DEF_TREE_NAME_PREFIX+(i+1);
			if(answer.get(name)!=null) {
				NewickBrokerElement first = broker.get(0);
				throw new MalformedNewickException("Duplicated tree name: "+name, first.getLine(), first.getColumn());
			}
			answer.add(name, buildTree(broker));
		}
		log.fine("Parsed "+answer.size()+" trees");
		return answer;
	}
	
	private List<LexerToken> tokenize(String text) throws TextFormatException {
		List<LexerToken> tokens = lexer.analyze(text);
		lexer.checkErrors();
		lexer.validateBrackets();
		return tokens;
	}
	
	private Tree<N,E> buildTree(NewickBroker broker) throws MalformedNewickException {
		Tree<N,E> tree = broker.toTree(nodeDataFactory, edgeDataFactory);
		if(broker.get(0).hasBranchLength()) log.fine("Branch length of the root element is not kept. Value: "+broker.get(0).getBranchLength());
		assert tree.validate() : "Inconsistent tree built from Newick text";
		log.fine("Built tree with "+tree.getNodeCount()+" nodes and "+tree.getLeafCount()+" leaves");
		return tree;
	}
	
	/**
	 * Writes the given tree in Newick format including the terminating semicolon
	 * @param tree to write
	 * @return String Newick representation
	 */
	public String print(Tree<N,E> tree) {
		NewickBroker broker = NewickBroker.fromTree(tree);
		return broker.toNewick(printNames, printBranchLengths, printComments, printTags, precision)+";";
	}
	
	public Tree<N,E> fromString(String text) throws TextFormatException {
		return parse(text);
	}
	
	public TreeCollection<N,E> fromStringToCollection(String text) throws TextFormatException {
		return parseCollection(text);
	}
	
	public String toString(Tree<N,E> tree) {
		return print(tree);
	}
	
	/**
	 * Loads the tree stored in the given file. Files ending in .gz are decompressed
	 * @param filename Path to the file
	 * @return Tree<N,E> tree in the file
	 * @throws IOException If the file can not be read or does not contain a valid tree
	 */
	public Tree<N,E> fromFile(String filename) throws IOException {
		log.info("Loading tree from file: "+filename);
		return parse(loadText(filename));
	}
	
	public Tree<N,E> fromStream(InputStream stream) throws IOException {
		return parse(loadText(stream));
	}
	
	public TreeCollection<N,E> fromFileToCollection(String filename) throws IOException {
		log.info("Loading trees from file: "+filename);
		TreeCollection<N,E> trees = parseCollection(loadText(filename));
		log.info("Loaded "+trees.size()+" trees from file: "+filename);
		return trees;
	}
	
	/**
	 * Saves the given tree in Newick format followed by a new line
	 * @param tree to save
	 * @param filename Path to the output file
	 * @throws IOException If the file can not be written
	 */
	public void toFile(Tree<N,E> tree, String filename) throws IOException {
		try (PrintStream out = new PrintStream(filename, StandardCharsets.UTF_8.name())) {
			out.println(print(tree));
			if(out.checkError()) throw new IOException("Error writing tree to file: "+filename);
		}
	}
	
	/**
	 * Saves the given trees, one per line with the format name = tree;
	 * @param trees to save
	 * @param filename Path to the output file
	 * @throws IOException If the file can not be written
	 */
	public void toFile(TreeCollection<N,E> trees, String filename) throws IOException {
		try (PrintStream out = new PrintStream(filename, StandardCharsets.UTF_8.name())) {
			for(int i=0;i<trees.size();i++) {
				out.println(NewickBroker.quoteName(trees.getName(i))+" = "+print(trees.get(i)));
			}
			if(out.checkError()) throw new IOException("Error writing trees to file: "+filename);
		}
		log.info("Saved "+trees.size()+" trees to file: "+filename);
	}
	
	private String loadText(String filename) throws IOException {
		try (InputStream stream = new FileInputStream(filename)) {
			if(filename.toLowerCase().endsWith(".gz")) {
				return loadText(new GZIPInputStream(stream));
			}
			return loadText(stream);
		}
	}
	
	private String loadText(InputStream stream) throws IOException {
		StringBuilder text = new StringBuilder();
		BufferedReader in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
		String line = in.readLine();
		while(line!=null) {
			text.append(line).append('\n');
			line = in.readLine();
		}
		return text.toString();
	}
}
