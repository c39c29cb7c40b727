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

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import phylotree.main.io.ParseUtils;
import phylotree.tree.Tree;
import phylotree.tree.TreeEdge;
import phylotree.tree.TreeNode;
import phylotree.tree.traversal.RoundtripTraversal;
import phylotree.tree.traversal.TraversalStep;

/**
 * Flat list of elements annotated with depths that mirrors the nesting of a Newick text.
 * Elements are stored in preorder. Consecutive depths can increase by at most one
 * @author PhyloTree contributors
 */
public class NewickBroker implements Iterable<NewickBrokerElement> {
	
	public static final String QUOTE_CHARACTERS = "()[]{},:;='\"";
	
	private String treeName;
	private final List<NewickBrokerElement> elements = new ArrayList<>();
	
	/**
	 * @return Name given to the tree in the text, or null if the tree was not named
	 */
	public String getTreeName() {
		return treeName;
	}
	
	public void setTreeName(String treeName) {
		this.treeName = treeName;
	}
	
	public void add(NewickBrokerElement element) {
		elements.add(element);
	}
	
	public NewickBrokerElement get(int index) {
		return elements.get(index);
	}
	
	public int size() {
		return elements.size();
	}
	
	public boolean isEmpty() {
		return elements.isEmpty();
	}
	
	public List<NewickBrokerElement> getElements() {
		return Collections.unmodifiableList(elements);
	}

	@Override
	public Iterator<NewickBrokerElement> iterator() {
		return getElements().iterator();
	}
	
	/**
	 * @param index Position of the element
	 * @return boolean true if the element at the given position has no children
	 */
	public boolean isLeaf(int index) {
		if(index+1>=elements.size()) return true;
		return elements.get(index+1).getDepth()<=elements.get(index).getDepth();
	}
	
	public int getMaxDepth() {
		int max = 0;
		for(NewickBrokerElement element:elements) max = Math.max(max, element.getDepth());
		return max;
	}
	
	/**
	 * Checks that the depths of the elements describe a single rooted tree
	 * @throws MalformedNewickException If the first element is not at depth zero, if there is a second
	 * element at depth zero or if the depth increases by more than one between consecutive elements
	 */
	public void validateDepths() throws MalformedNewickException {
		int previous = -1;
		for(int i=0;i<elements.size();i++) {
			NewickBrokerElement element = elements.get(i);
			int depth = element.getDepth();
			if(i==0 && depth!=0) throw new MalformedNewickException("First element must be at depth 0. Depth: "+depth, element.getLine(), element.getColumn());
			if(i>0 && depth==0) throw new MalformedNewickException("Second root element found at position "+i, element.getLine(), element.getColumn());
			if(depth>previous+1) throw new MalformedNewickException("Depth increases from "+previous+" to "+depth+" at position "+i, element.getLine(), element.getColumn());
			previous = depth;
		}
	}
	
	/**
	 * Creates a broker with the elements of the given tree seen from its root
	 * @param tree to flatten
	 * @return NewickBroker Elements of the tree in preorder
	 */
	public static <N extends NewickPayload, E extends NewickPayload> NewickBroker fromTree(Tree<N,E> tree) {
		NewickBroker broker = new NewickBroker();
		if(tree.isEmpty()) return broker;
		for(TraversalStep<N,E> step:new RoundtripTraversal<>(tree)) {
			if(!step.isFirstVisit()) continue;
			NewickBrokerElement element = new NewickBrokerElement(step.getDepth());
			N nodeData = step.getNode().getData();
			if(nodeData!=null) nodeData.toNewickElement(element);
			TreeEdge<N,E> edge = step.getEdge();
			if(edge!=null && edge.getData()!=null) edge.getData().toNewickElement(element);
			element.setDepth(step.getDepth());
			broker.add(element);
		}
		return broker;
	}
	
	/**
	 * Builds a tree from the elements of this broker. The root element does not produce an edge,
	 * so its branch length is not kept
	 * @param nodeFactory Creates the payload of each node
	 * @param edgeFactory Creates the payload of the edge between each element and its parent
	 * @return Tree<N,E> new tree whose root is the first element
	 * @throws MalformedNewickException If the depths do not describe a tree
	 */
	public <N,E> Tree<N,E> toTree(NewickPayloadFactory<N> nodeFactory, NewickPayloadFactory<E> edgeFactory) throws MalformedNewickException {
		validateDepths();
		Tree<N,E> tree = new Tree<>();
		// Most recent node created at each depth
		List<TreeNode<N,E>> stack = new ArrayList<>();
		for(NewickBrokerElement element:elements) {
			int depth = element.getDepth();
			while(stack.size()>depth) stack.remove(stack.size()-1);
			TreeNode<N,E> node = tree.addNode(nodeFactory.fromNewickElement(element));
			if(depth>0) {
				TreeNode<N,E> parent = stack.get(depth-1);
				tree.addEdge(parent, node, edgeFactory.fromNewickElement(element));
			}
			stack.add(node);
		}
		return tree;
	}
	
	/**
	 * Writes the elements as nested groups without the terminating semicolon
	 * @param printNames Tells if names should be written
	 * @param printBranchLengths Tells if branch lengths should be written
	 * @param printComments Tells if comments should be written
	 * @param printTags Tells if tags should be written
	 * @param precision Maximum number of decimal places for branch lengths, or {@link ParseUtils#EXACT_PRECISION}
	 * to write lengths with every significant digit
	 * @return String Newick representation of the elements
	 */
	public String toNewick(boolean printNames, boolean printBranchLengths, boolean printComments, boolean printTags, int precision) {
		DecimalFormat format = precision==ParseUtils.EXACT_PRECISION?null:ParseUtils.createDecimalFormat(precision);
		StringBuilder answer = new StringBuilder();
		List<NewickBrokerElement> open = new ArrayList<>();
		for(int i=0;i<elements.size();i++) {
			NewickBrokerElement element = elements.get(i);
			int depth = element.getDepth();
			while(!open.isEmpty() && open.get(open.size()-1).getDepth()>=depth) {
				answer.append(')');
				appendLabel(answer, open.remove(open.size()-1), printNames, printBranchLengths, printComments, printTags, format);
			}
			if(i>0 && elements.get(i-1).getDepth()>=depth) answer.append(',');
			if(isLeaf(i)) {
				appendLabel(answer, element, printNames, printBranchLengths, printComments, printTags, format);
			} else {
				answer.append('(');
				open.add(element);
			}
		}
		while(!open.isEmpty()) {
			answer.append(')');
			appendLabel(answer, open.remove(open.size()-1), printNames, printBranchLengths, printComments, printTags, format);
		}
		return answer.toString();
	}
	
	private void appendLabel(StringBuilder answer, NewickBrokerElement element, boolean printNames, boolean printBranchLengths, boolean printComments, boolean printTags, DecimalFormat format) {
		if(printNames) answer.append(quoteName(element.getName()));
		if(printBranchLengths && element.hasBranchLength()) {
			double length = element.getBranchLength();
			answer.append(':').append(format!=null?format.format(length):ParseUtils.formatExact(length));
		}
		if(printTags) {
			for(String tag:element.getTags()) answer.append('{').append(tag).append('}');
		}
		if(printComments) {
			for(String comment:element.getComments()) answer.append('[').append(comment).append(']');
		}
	}
	
	/**
	 * Encloses the given name in single quotes if it contains whitespace or Newick delimiters
	 * @param name to write
	 * @return String the name ready to be written in a Newick text
	 */
	public static String quoteName(String name) {
		boolean quote = false;
		for(int i=0;i<name.length() && !quote;i++) {
			char c = name.charAt(i);
			if(Character.isWhitespace(c) || Character.isISOControl(c) || QUOTE_CHARACTERS.indexOf(c)>=0) quote = true;
		}
		if(!quote) return name;
		StringBuilder answer = new StringBuilder("'");
		for(int i=0;i<name.length();i++) {
			char c = name.charAt(i);
			if(c=='\'' || c=='\\') answer.append('\\').append(c);
			else if (c=='\n') answer.append("\\n");
			else if (c=='\t') answer.append("\\t");
			else if (c=='\r') answer.append("\\r");
			else answer.append(c);
		}
		answer.append('\'');
		return answer.toString();
	}
	
	/**
	 * @return String with one line per element indented by depth
	 */
	public String dump() {
		StringBuilder answer = new StringBuilder();
		if(treeName!=null) answer.append("Tree: ").append(treeName).append('\n');
		for(NewickBrokerElement element:elements) {
			for(int i=0;i<element.getDepth();i++) answer.append("  ");
			answer.append(element).append('\n');
		}
		return answer.toString();
	}
}
