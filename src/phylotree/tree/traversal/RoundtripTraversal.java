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
 * Reports an enter event before descending into the subtree of a node and an exit event after
 * returning from it. Enter events are steps with {@link TraversalStep#isFirstVisit()} and exit events
 * are steps with {@link TraversalStep#isLastVisit()}. Nodes without children produce a single step
 * that is both the enter and the exit event. Used to print nested structures like Newick.
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class RoundtripTraversal<N,E> extends TreeTraversal<N,E> {

	public RoundtripTraversal(Tree<N,E> tree) {
		super(tree);
	}

	public RoundtripTraversal(Tree<N,E> tree, TreeNode<N,E> start) {
		super(tree, start);
	}

	@Override
	public Iterator<TraversalStep<N,E>> iterator() {
		return new RoundtripIterator();
	}
	
	private class RoundtripIterator extends StepIterator {
		private final Deque<Frame> stack = new ArrayDeque<>();
		private TraversalStep<N,E> pendingEntry;
		
		private RoundtripIterator() {
			pendingEntry = createStartStep();
		}
		
		@Override
		protected TraversalStep<N,E> calculateNext() {
			while (pendingEntry!=null || !stack.isEmpty()) {
				if(pendingEntry!=null) {
					Frame frame = new Frame(pendingEntry);
					pendingEntry = null;
					if(!frame.hasMoreChildren()) return frame.step.withVisit(true, true);
					stack.push(frame);
					return frame.step.withVisit(true, false);
				}
				Frame frame = stack.peek();
				if(frame.hasMoreChildren()) {
					pendingEntry = frame.nextChild();
				} else {
					stack.pop();
					return frame.step.withVisit(false, true);
				}
			}
			return null;
		}
	}
}
