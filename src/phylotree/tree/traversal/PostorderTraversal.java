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
import phylotree.tree.TreeNode;

/**
 * Visits every node after all its descendants
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class PostorderTraversal<N,E> extends TreeTraversal<N,E> {

	public PostorderTraversal(Tree<N,E> tree) {
		super(tree);
	}

	public PostorderTraversal(Tree<N,E> tree, TreeNode<N,E> start) {
		super(tree, start);
	}

	@Override
	public Iterator<TraversalStep<N,E>> iterator() {
		return new PostorderIterator();
	}
	
	private class PostorderIterator extends StepIterator {
		private final Deque<Frame> stack = new ArrayDeque<>();
		
		private PostorderIterator() {
			TraversalStep<N,E> first = createStartStep();
			if(first!=null) stack.push(new Frame(first));
		}
		
		@Override
		protected TraversalStep<N,E> calculateNext() {
			while (!stack.isEmpty()) {
				Frame frame = stack.peek();
				if(frame.hasMoreChildren()) {
					stack.push(new Frame(frame.nextChild()));
				} else {
					stack.pop();
					return frame.step;
				}
			}
			return null;
		}
	}
}
