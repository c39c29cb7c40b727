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
 * Walks around the tree traversing each edge twice, once in each direction. A node is reported
 * when the walk arrives at it, either going down from its parent or coming back from a child.
 * The number of steps is twice the number of edges plus one.
 * The first visit of a node is the arrival from its parent and the last visit is the return from its last child
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class EulerTourTraversal<N,E> extends TreeTraversal<N,E> {

	public EulerTourTraversal(Tree<N,E> tree) {
		super(tree);
	}

	public EulerTourTraversal(Tree<N,E> tree, TreeNode<N,E> start) {
		super(tree, start);
	}

	@Override
	public Iterator<TraversalStep<N,E>> iterator() {
		return new EulerTourIterator();
	}
	
	private class EulerTourIterator extends StepIterator {
		private final Deque<Frame> stack = new ArrayDeque<>();
		private TraversalStep<N,E> pendingArrival;
		
		private EulerTourIterator() {
			pendingArrival = createStartStep();
		}
		
		@Override
		protected TraversalStep<N,E> calculateNext() {
			if(pendingArrival!=null) {
				Frame frame = new Frame(pendingArrival);
				pendingArrival = null;
				stack.push(frame);
				return frame.step.withVisit(true, !frame.hasMoreChildren());
			}
			if(stack.isEmpty()) return null;
			Frame frame = stack.peek();
			if(frame.hasMoreChildren()) {
				pendingArrival = frame.nextChild();
				return calculateNext();
			}
			stack.pop();
			Frame parent = stack.peek();
			if(parent == null) return null;
			TraversalStep<N,E> parentStep = parent.step;
			return new TraversalStep<>(parentStep.getNode(), frame.step.getEdge(), frame.step.getLink().getOuter(), parentStep.getDepth(), false, !parent.hasMoreChildren());
		}
	}
}
