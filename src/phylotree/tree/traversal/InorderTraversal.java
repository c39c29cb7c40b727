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
package phylotree.tree.traversal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import phylotree.tree.Tree;
import phylotree.tree.TreeLink;
import phylotree.tree.TreeNode;

/**
 * Visits the subtree of the first child, then the node, then the subtrees of the remaining children.
 * Only defined for nodes with at most three adjacent edges. Creating an iterator over a tree having a
 * node with more than three edges throws an {@link UnsupportedTopologyException}
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class InorderTraversal<N,E> extends TreeTraversal<N,E> {
	
	public static final int MAX_DEGREE = 3;

	public InorderTraversal(Tree<N,E> tree) {
		super(tree);
	}

	public InorderTraversal(Tree<N,E> tree, TreeNode<N,E> start) {
		super(tree, start);
	}

	/**
	 * @throws UnsupportedTopologyException If a node reachable from the start node has more than three edges
	 */
	@Override
	public Iterator<TraversalStep<N,E>> iterator() {
		checkTopology();
		return new InorderIterator();
	}
	
	private void checkTopology() {
		if(start == null) return;
		Deque<TraversalStep<N,E>> agenda = new ArrayDeque<>();
		agenda.push(createStartStep());
		while (!agenda.isEmpty()) {
			TraversalStep<N,E> step = agenda.pop();
			TreeNode<N,E> node = step.getNode();
			int degree = tree.getDegree(node);
			if(degree > MAX_DEGREE) throw new UnsupportedTopologyException("Inorder traversal is only defined for nodes with at most "+MAX_DEGREE+" edges. Found "+degree, node);
			for(TreeLink<N,E> link:getOutgoingLinks(node, step.getLink())) agenda.push(descend(link, step.getDepth()));
		}
	}
	
	private class InorderIterator extends StepIterator {
		private final Deque<Frame> stack = new ArrayDeque<>();
		
		private InorderIterator() {
			TraversalStep<N,E> first = createStartStep();
			if(first!=null) stack.push(new Frame(first));
		}
		
		@Override
		protected TraversalStep<N,E> calculateNext() {
			while (!stack.isEmpty()) {
				Frame frame = stack.peek();
				if(!frame.visited) {
					if(frame.next==0 && frame.hasMoreChildren()) {
						stack.push(new Frame(frame.nextChild()));
						continue;
					}
					frame.visited = true;
					return frame.step;
				}
				if(frame.hasMoreChildren()) stack.push(new Frame(frame.nextChild()));
				else stack.pop();
			}
			return null;
		}
	}
}
