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
package phylotree.tree.distance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

import phylotree.tree.Tree;
import phylotree.tree.TreeNode;
import phylotree.tree.io.DefaultEdgeData;
import phylotree.tree.io.DefaultNodeData;
import phylotree.tree.traversal.PreorderTraversal;
import phylotree.tree.traversal.TraversalStep;
import phylotree.tree.traversal.Traversals;

/**
 * Distances between the nodes of a tree. Vectors and matrices are indexed by node index.
 * Entries for removed node slots are -1 for edge counts and NaN for branch lengths
 * @author PhyloTree contributors
 */
public class TreeDistances {
	
	/**
	 * Length of the branches of trees with default payloads. Unknown lengths count as zero
	 */
	public static final ToDoubleFunction<DefaultEdgeData> DEFAULT_BRANCH_LENGTH = (data) -> (data==null || !data.hasBranchLength())?0:data.getBranchLength();
	
	/**
	 * Calculates the number of edges between the given node and every node of the tree
	 * @param tree to process
	 * @param from Node to calculate distances from
	 * @return int[] Distances indexed by node index
	 */
	public static <N,E> int [] nodeDepthVector(Tree<N,E> tree, TreeNode<N,E> from) {
		int [] answer = new int[tree.getNodeSlots()];
		Arrays.fill(answer, -1);
		for(TraversalStep<N,E> step:new PreorderTraversal<>(tree, from)) {
			answer[step.getNode().getIndex()] = step.getDepth();
		}
		return answer;
	}
	
	/**
	 * @param tree to process
	 * @return int[][] Number of edges between every pair of nodes
	 */
	public static <N,E> int [][] nodeDepthMatrix(Tree<N,E> tree) {
		int n = tree.getNodeSlots();
		int [][] answer = new int[n][];
		for(int i=0;i<n;i++) {
			answer[i] = new int[n];
			Arrays.fill(answer[i], -1);
		}
		for(TreeNode<N,E> node:tree.getNodes()) {
			answer[node.getIndex()] = nodeDepthVector(tree, node);
		}
		return answer;
	}
	
	/**
	 * Calculates the sum of branch lengths between the given node and every node of the tree
	 * @param tree to process
	 * @param from Node to calculate distances from
	 * @param branchLength Function to obtain the length of a branch from the edge data
	 * @return double[] Distances indexed by node index
	 */
	public static <N,E> double [] branchDistanceVector(Tree<N,E> tree, TreeNode<N,E> from, ToDoubleFunction<E> branchLength) {
		double [] answer = new double[tree.getNodeSlots()];
		Arrays.fill(answer, Double.NaN);
		for(TraversalStep<N,E> step:new PreorderTraversal<>(tree, from)) {
			int idx = step.getNode().getIndex();
			if(step.isStart()) {
				answer[idx] = 0;
				continue;
			}
			TreeNode<N,E> parent = step.getLink().getOuter().getNode();
			answer[idx] = answer[parent.getIndex()]+branchLength.applyAsDouble(step.getEdge().getData());
		}
		return answer;
	}
	
	public static double [] branchDistanceVector(Tree<DefaultNodeData,DefaultEdgeData> tree, TreeNode<DefaultNodeData,DefaultEdgeData> from) {
		return branchDistanceVector(tree, from, DEFAULT_BRANCH_LENGTH);
	}
	
	public static <N,E> double [][] branchDistanceMatrix(Tree<N,E> tree, ToDoubleFunction<E> branchLength) {
		int n = tree.getNodeSlots();
		double [][] answer = new double[n][];
		for(int i=0;i<n;i++) {
			answer[i] = new double[n];
			Arrays.fill(answer[i], Double.NaN);
		}
		for(TreeNode<N,E> node:tree.getNodes()) {
			answer[node.getIndex()] = branchDistanceVector(tree, node, branchLength);
		}
		return answer;
	}
	
	public static double [][] branchDistanceMatrix(Tree<DefaultNodeData,DefaultEdgeData> tree) {
		return branchDistanceMatrix(tree, DEFAULT_BRANCH_LENGTH);
	}
	
	/**
	 * Builds the matrix of branch length distances between the leaves of the tree
	 * @param tree to process
	 * @param leafName Function to obtain the id of a leaf from its data
	 * @param branchLength Function to obtain the length of a branch from the edge data
	 * @return DistanceMatrix Distances between leaves in the preorder of the leaves
	 */
	public static <N,E> DistanceMatrix leafDistanceMatrix(Tree<N,E> tree, Function<N,String> leafName, ToDoubleFunction<E> branchLength) {
		List<TreeNode<N,E>> leaves = Traversals.leaves(tree);
		int n = leaves.size();
		List<String> ids = new ArrayList<>(n);
		double [][] distances = new double[n][n];
		for(int i=0;i<n;i++) {
			TreeNode<N,E> leaf = leaves.get(i);
			ids.add(leafName.apply(leaf.getData()));
			double [] fromLeaf = branchDistanceVector(tree, leaf, branchLength);
			for(int j=0;j<n;j++) {
				distances[i][j] = fromLeaf[leaves.get(j).getIndex()];
			}
		}
		return new DistanceMatrix(ids, distances);
	}
	
	public static DistanceMatrix leafDistanceMatrix(Tree<DefaultNodeData,DefaultEdgeData> tree) {
		return leafDistanceMatrix(tree, (data) -> (data==null)?"":data.getName(), DEFAULT_BRANCH_LENGTH);
	}
	
	/**
	 * @param tree to process
	 * @param from Node to calculate distances from
	 * @param branchLength Function to obtain the length of a branch from the edge data
	 * @return double Largest branch length distance between the given node and a leaf
	 */
	public static <N,E> double deepestLeafDistance(Tree<N,E> tree, TreeNode<N,E> from, ToDoubleFunction<E> branchLength) {
		double [] distances = branchDistanceVector(tree, from, branchLength);
		double max = 0;
		for(TreeNode<N,E> node:tree.getNodes()) {
			if(tree.getDegree(node)<=1 && distances[node.getIndex()]>max) max = distances[node.getIndex()];
		}
		return max;
	}
	
	public static double deepestLeafDistance(Tree<DefaultNodeData,DefaultEdgeData> tree) {
		return deepestLeafDistance(tree, tree.getRoot(), DEFAULT_BRANCH_LENGTH);
	}
}
