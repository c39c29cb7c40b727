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

import java.util.ArrayList;
import java.util.List;

import phylotree.tree.Tree;
import phylotree.tree.TreeNode;

/**
 * Shortcuts to obtain the nodes of the traversals starting at the root of a tree
 * @author PhyloTree contributors
 */
public class Traversals {
	
	public static <N,E> List<TreeNode<N,E>> preorderNodes(Tree<N,E> tree) {
		return new PreorderTraversal<>(tree).nodes();
	}
	
	public static <N,E> List<TreeNode<N,E>> postorderNodes(Tree<N,E> tree) {
		return new PostorderTraversal<>(tree).nodes();
	}
	
	public static <N,E> List<TreeNode<N,E>> levelorderNodes(Tree<N,E> tree) {
		return new LevelorderTraversal<>(tree).nodes();
	}
	
	/**
	 * @param tree to traverse
	 * @return List<TreeNode> nodes in inorder
	 * @throws UnsupportedTopologyException If the tree has a node with more than three edges
	 */
	public static <N,E> List<TreeNode<N,E>> inorderNodes(Tree<N,E> tree) {
		return new InorderTraversal<>(tree).nodes();
	}
	
	public static <N,E> List<TreeNode<N,E>> eulerTourNodes(Tree<N,E> tree) {
		return new EulerTourTraversal<>(tree).nodes();
	}
	
	public static <N,E> List<TreeNode<N,E>> pathNodes(Tree<N,E> tree, TreeNode<N,E> from, TreeNode<N,E> to) {
		return new PathTraversal<>(tree, from, to).nodes();
	}
	
	/**
	 * @param tree to traverse
	 * @return List<TreeNode> Nodes without children in preorder
	 */
	public static <N,E> List<TreeNode<N,E>> leaves(Tree<N,E> tree) {
		List<TreeNode<N,E>> answer = new ArrayList<>();
		for(TraversalStep<N,E> step:new PreorderTraversal<>(tree)) {
			int expectedDegree = step.isStart()?0:1;
			if(tree.getDegree(step.getNode())==expectedDegree) answer.add(step.getNode());
		}
		return answer;
	}
}
