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
import java.util.List;

import phylotree.tree.Tree;
import phylotree.tree.TreeLink;
import phylotree.tree.TreeNode;

/**
 * Visits every node before its descendants
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class PreorderTraversal<N,E> extends TreeTraversal<N,E> {

	public PreorderTraversal(Tree<N,E> tree) {
		super(tree);
	}

	public PreorderTraversal(Tree<N,E> tree, TreeNode<N,E> start) {
		super(tree, start);
	}

	@Override
	public Iterator<TraversalStep<N,E>> iterator() {
		return new PreorderIterator();
	}
	
	private class PreorderIterator extends StepIterator {
		private final Deque<TraversalStep<N,E>> stack = new ArrayDeque<>();
		
		private PreorderIterator() {
			TraversalStep<N,E> first = createStartStep();
			if(first!=null) stack.push(first);
		}
		
		@Override
		protected TraversalStep<N,E> calculateNext() {
			if(stack.isEmpty()) return null;
			TraversalStep<N,E> step = stack.pop();
			List<TreeLink<N,E>> outgoing = getOutgoingLinks(step.getNode(), step.getLink());
			for(int i=outgoing.size()-1;i>=0;i--) {
				stack.push(descend(outgoing.get(i), step.getDepth()));
			}
			return step;
		}
	}
}
