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
package phylotree.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Topology of a phylogenetic tree. Nodes, edges and links are stored in three lists addressed
 * by dense zero-based indices. References between them are indices resolved through this tree.
 * Node and edge payloads are opaque to the tree.
 * <p>
 * The root is metadata only. Directions relative to the root are calculated when needed by
 * {@link TreeOrientation}, so changing the root does not rewrite the structure.
 * </p>
 * <p>
 * Removing a subtree leaves gaps in the lists until {@link #compact()} is called. After
 * {@link #compact()} or {@link #clear()} every node, edge or link obtained before becomes invalid
 * and using it with this tree throws a {@link StructureException}. Traversals over the tree fail with a
 * {@link java.util.ConcurrentModificationException} if the structure is modified while they are running.
 * </p>
 * This class is not thread safe.
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class Tree<N,E> {
	
	private Logger log = Logger.getLogger(Tree.class.getName());
	
	private final List<TreeNode<N,E>> nodes = new ArrayList<>();
	private final List<TreeEdge<N,E>> edges = new ArrayList<>();
	private final List<TreeLink<N,E>> links = new ArrayList<>();
	private int numNodes = 0;
	private int numEdges = 0;
	private int numLinks = 0;
	private int rootIndex = -1;
	private int modificationCount = 0;
	
	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		if (log == null) throw new NullPointerException("Log can not be null");
		this.log = log;
	}
	
	/**
	 * Adds a new node without edges. The first node added becomes the root
	 * @param data Payload of the new node
	 * @return TreeNode the new node
	 */
	public TreeNode<N,E> addNode(N data) {
		TreeNode<N,E> node = new TreeNode<>(this, nodes.size(), data);
		nodes.add(node);
		numNodes++;
		if(rootIndex<0) rootIndex = node.getIndex();
		modificationCount++;
		return node;
	}
	
	/**
	 * Connects two nodes with a new edge. Each new link is added at the end of the circular list
	 * of its node, which preserves the order in which edges are added.
	 * @param nodeA First node. The primary link of the edge is located at this node
	 * @param nodeB Second node
	 * @param data Payload of the new edge
	 * @return TreeEdge the new edge
	 * @throws StructureException if the nodes are the same, if one of them is not a valid node of this tree
	 * or if they are already connected through a path of edges
	 */
	public TreeEdge<N,E> addEdge(TreeNode<N,E> nodeA, TreeNode<N,E> nodeB, E data) {
		checkNode(nodeA);
		checkNode(nodeB);
		if(nodeA == nodeB) throw new StructureException("Self loops are not allowed. Node: "+nodeA.getIndex());
		if(isConnected(nodeA, nodeB)) throw new StructureException("Nodes "+nodeA.getIndex()+" and "+nodeB.getIndex()+" are already connected. A new edge would create a cycle");
		TreeEdge<N,E> edge = new TreeEdge<>(this, edges.size(), data);
		edges.add(edge);
		TreeLink<N,E> linkA = new TreeLink<>(this, links.size(), nodeA.getIndex(), edge.getIndex());
		links.add(linkA);
		TreeLink<N,E> linkB = new TreeLink<>(this, links.size(), nodeB.getIndex(), edge.getIndex());
		links.add(linkB);
		linkA.setOuterIndex(linkB.getIndex());
		linkB.setOuterIndex(linkA.getIndex());
		edge.setLinkIndexes(linkA.getIndex(), linkB.getIndex());
		insertLink(nodeA, linkA);
		insertLink(nodeB, linkB);
		numEdges++;
		numLinks+=2;
		modificationCount++;
		return edge;
	}
	
	private boolean isConnected(TreeNode<N,E> nodeA, TreeNode<N,E> nodeB) {
		if(nodeA.getLinkIndex()<0 || nodeB.getLinkIndex()<0) return false;
		boolean [] visited = new boolean[nodes.size()];
		Deque<Integer> agenda = new ArrayDeque<>();
		visited[nodeA.getIndex()] = true;
		agenda.add(nodeA.getIndex());
		while(!agenda.isEmpty()) {
			TreeNode<N,E> node = nodes.get(agenda.poll());
			int first = node.getLinkIndex();
			if(first<0) continue;
			TreeLink<N,E> link = links.get(first);
			do {
				int neighbor = links.get(link.getOuterIndex()).getNodeIndex();
				if(neighbor == nodeB.getIndex()) return true;
				if(!visited[neighbor]) {
					visited[neighbor] = true;
					agenda.add(neighbor);
				}
				link = links.get(link.getNextIndex());
			} while (link.getIndex()!=first);
		}
		return false;
	}
	
	private void insertLink(TreeNode<N,E> node, TreeLink<N,E> link) {
		int first = node.getLinkIndex();
		if(first<0) {
			node.setLinkIndex(link.getIndex());
			link.setNextIndex(link.getIndex());
			return;
		}
		TreeLink<N,E> last = findPrevious(links.get(first));
		last.setNextIndex(link.getIndex());
		link.setNextIndex(first);
	}
	
	private TreeLink<N,E> findPrevious(TreeLink<N,E> link) {
		TreeLink<N,E> current = link;
		int steps = 0;
		while (current.getNextIndex()!=link.getIndex()) {
			current = links.get(current.getNextIndex());
			steps++;
			if(steps>links.size()) throw new StructureException("Corrupted list of links at node "+link.getNodeIndex());
		}
		return current;
	}
	
	/**
	 * @return TreeNode root of the tree. Null if the tree is empty
	 */
	public TreeNode<N,E> getRoot() {
		if(rootIndex<0) return null;
		return nodes.get(rootIndex);
	}
	
	/**
	 * Changes the root of the tree. The structure is not modified
	 * @param node New root
	 */
	public void setRoot(TreeNode<N,E> node) {
		checkNode(node);
		rootIndex = node.getIndex();
	}
	
	public boolean isEmpty() {
		return numNodes==0;
	}
	
	public int getNodeCount() {
		return numNodes;
	}
	
	public int getEdgeCount() {
		return numEdges;
	}
	
	public int getLinkCount() {
		return numLinks;
	}
	
	/**
	 * @return int Size of the list of nodes, including gaps left by removed nodes.
	 * All node indexes are smaller than this number
	 */
	public int getNodeSlots() {
		return nodes.size();
	}
	
	public int getEdgeSlots() {
		return edges.size();
	}
	
	public int getLinkSlots() {
		return links.size();
	}
	
	public int getModificationCount() {
		return modificationCount;
	}
	
	public TreeNode<N,E> getNode(int index) {
		if(index<0 || index>=nodes.size() || nodes.get(index)==null) throw new StructureException("There is no node at index "+index);
		return nodes.get(index);
	}
	
	public TreeEdge<N,E> getEdge(int index) {
		if(index<0 || index>=edges.size() || edges.get(index)==null) throw new StructureException("There is no edge at index "+index);
		return edges.get(index);
	}
	
	public TreeLink<N,E> getLink(int index) {
		if(index<0 || index>=links.size() || links.get(index)==null) throw new StructureException("There is no link at index "+index);
		return links.get(index);
	}
	
	/**
	 * @return List<TreeNode> Nodes of the tree in index order
	 */
	public List<TreeNode<N,E>> getNodes() {
		return liveEntries(nodes);
	}
	
	public List<TreeEdge<N,E>> getEdges() {
		return liveEntries(edges);
	}
	
	public List<TreeLink<N,E>> getLinks() {
		return liveEntries(links);
	}
	
	private <T> List<T> liveEntries(List<T> entries) {
		List<T> answer = new ArrayList<>(entries.size());
		for(T entry:entries) {
			if(entry!=null) answer.add(entry);
		}
		return Collections.unmodifiableList(answer);
	}
	
	/**
	 * @param node to query
	 * @return int Number of edges adjacent to the given node
	 */
	public int getDegree(TreeNode<N,E> node) {
		checkNode(node);
		int first = node.getLinkIndex();
		if(first<0) return 0;
		int degree = 1;
		TreeLink<N,E> current = links.get(links.get(first).getNextIndex());
		while (current.getIndex()!=first) {
			degree++;
			if(degree>numLinks) throw new StructureException("Corrupted list of links at node "+node.getIndex());
			current = links.get(current.getNextIndex());
		}
		return degree;
	}
	
	/**
	 * Returns the links of the given node following the circular list from the link stored in the node
	 * @param node to query
	 * @return List<TreeLink> links of the node in insertion order
	 */
	public List<TreeLink<N,E>> getLinksAround(TreeNode<N,E> node) {
		checkNode(node);
		List<TreeLink<N,E>> answer = new ArrayList<>();
		int first = node.getLinkIndex();
		if(first<0) return answer;
		TreeLink<N,E> current = links.get(first);
		do {
			answer.add(current);
			if(answer.size()>numLinks) throw new StructureException("Corrupted list of links at node "+node.getIndex());
			current = links.get(current.getNextIndex());
		} while (current.getIndex()!=first);
		return answer;
	}
	
	/**
	 * @param node to query
	 * @return true if the node has at most one adjacent edge
	 */
	public boolean isLeaf(TreeNode<N,E> node) {
		return getDegree(node)<=1;
	}
	
	/**
	 * @return int Number of nodes with at most one adjacent edge, not counting a root with one child
	 */
	public int getLeafCount() {
		int count = 0;
		for(TreeNode<N,E> node:nodes) {
			if(node == null) continue;
			int degree = getDegree(node);
			if(degree==0 || (degree==1 && node.getIndex()!=rootIndex)) count++;
		}
		return count;
	}
	
	public void checkNode(TreeNode<?,?> node) {
		if(node == null) throw new StructureException("Null node reference");
		if(node.getTree()!=this) throw new StructureException("Node "+node.getIndex()+" does not belong to this tree");
		int index = node.getIndex();
		if(index<0 || index>=nodes.size() || nodes.get(index)!=node) throw new StructureException("Invalid reference to node "+index);
	}
	
	public void checkEdge(TreeEdge<?,?> edge) {
		if(edge == null) throw new StructureException("Null edge reference");
		if(edge.getTree()!=this) throw new StructureException("Edge "+edge.getIndex()+" does not belong to this tree");
		int index = edge.getIndex();
		if(index<0 || index>=edges.size() || edges.get(index)!=edge) throw new StructureException("Invalid reference to edge "+index);
	}
	
	public void checkLink(TreeLink<?,?> link) {
		if(link == null) throw new StructureException("Null link reference");
		if(link.getTree()!=this) throw new StructureException("Link "+link.getIndex()+" does not belong to this tree");
		int index = link.getIndex();
		if(index<0 || index>=links.size() || links.get(index)!=link) throw new StructureException("Invalid reference to link "+index);
	}
	
	/**
	 * Removes the given edge and the subtree located at the side of the edge opposite to the root.
	 * Removed nodes, edges and links leave gaps until {@link #compact()} is called
	 * @param edge Edge connecting the subtree to be removed
	 */
	public void removeSubtree(TreeEdge<N,E> edge) {
		checkEdge(edge);
		TreeNode<N,E> root = getRoot();
		TreeOrientation<N,E> orientation = new TreeOrientation<>(this, root);
		TreeLink<N,E> upper = orientation.getPrimaryLink(edge);
		TreeNode<N,E> subtreeRoot = upper.getOuter().getNode();
		List<TreeNode<N,E>> removedNodes = new ArrayList<>();
		Deque<TreeNode<N,E>> agenda = new ArrayDeque<>();
		agenda.push(subtreeRoot);
		while (!agenda.isEmpty()) {
			TreeNode<N,E> node = agenda.pop();
			removedNodes.add(node);
			for(TreeNode<N,E> child:orientation.getChildren(node)) agenda.push(child);
		}
		List<TreeLink<N,E>> removedLinks = new ArrayList<>();
		for(TreeNode<N,E> node:removedNodes) removedLinks.addAll(getLinksAround(node));
		unlinkFromNode(upper);
		for(TreeLink<N,E> link:removedLinks) removeEdgeEntry(link.getEdgeIndex());
		for(TreeNode<N,E> node:removedNodes) {
			nodes.set(node.getIndex(), null);
			node.detach();
			numNodes--;
		}
		modificationCount++;
		log.fine("Removed subtree with "+removedNodes.size()+" nodes. Remaining nodes: "+numNodes);
	}
	
	private void unlinkFromNode(TreeLink<N,E> link) {
		TreeNode<N,E> node = nodes.get(link.getNodeIndex());
		if(link.getNextIndex() == link.getIndex()) {
			node.setLinkIndex(-1);
			return;
		}
		TreeLink<N,E> previous = findPrevious(link);
		previous.setNextIndex(link.getNextIndex());
		if(node.getLinkIndex()==link.getIndex()) node.setLinkIndex(link.getNextIndex());
		link.setNextIndex(link.getIndex());
	}
	
	private void removeEdgeEntry(int edgeIndex) {
		TreeEdge<N,E> edge = edges.get(edgeIndex);
		if(edge == null) return;
		removeLinkEntry(edge.getPrimaryLinkIndex());
		removeLinkEntry(edge.getSecondaryLinkIndex());
		edges.set(edgeIndex, null);
		edge.detach();
		numEdges--;
	}
	
	private void removeLinkEntry(int linkIndex) {
		TreeLink<N,E> link = links.get(linkIndex);
		if(link == null) return;
		links.set(linkIndex, null);
		link.detach();
		numLinks--;
	}
	
	/**
	 * Rewrites the indexes of nodes, edges and links to remove the gaps left by removals.
	 * All nodes, edges and links obtained before calling this method become invalid.
	 * They must be obtained again through the getters of this tree
	 */
	public void compact() {
		int [] nodeMap = buildIndexMap(nodes);
		int [] edgeMap = buildIndexMap(edges);
		int [] linkMap = buildIndexMap(links);
		List<TreeNode<N,E>> newNodes = new ArrayList<>(numNodes);
		for(TreeNode<N,E> node:nodes) {
			if(node==null) continue;
			TreeNode<N,E> copy = new TreeNode<>(this, newNodes.size(), node.getData());
			if(node.getLinkIndex()>=0) copy.setLinkIndex(linkMap[node.getLinkIndex()]);
			newNodes.add(copy);
			node.detach();
		}
		List<TreeEdge<N,E>> newEdges = new ArrayList<>(numEdges);
		for(TreeEdge<N,E> edge:edges) {
			if(edge==null) continue;
			TreeEdge<N,E> copy = new TreeEdge<>(this, newEdges.size(), edge.getData());
			copy.setLinkIndexes(linkMap[edge.getPrimaryLinkIndex()], linkMap[edge.getSecondaryLinkIndex()]);
			newEdges.add(copy);
			edge.detach();
		}
		List<TreeLink<N,E>> newLinks = new ArrayList<>(numLinks);
		for(TreeLink<N,E> link:links) {
			if(link==null) continue;
			TreeLink<N,E> copy = new TreeLink<>(this, newLinks.size(), nodeMap[link.getNodeIndex()], edgeMap[link.getEdgeIndex()]);
			copy.setNextIndex(linkMap[link.getNextIndex()]);
			copy.setOuterIndex(linkMap[link.getOuterIndex()]);
			newLinks.add(copy);
			link.detach();
		}
		int removed = nodes.size()-newNodes.size();
		nodes.clear();
		nodes.addAll(newNodes);
		edges.clear();
		edges.addAll(newEdges);
		links.clear();
		links.addAll(newLinks);
		if(rootIndex>=0) rootIndex = nodeMap[rootIndex];
		modificationCount++;
		log.fine("Compacted tree. Removed "+removed+" node gaps");
	}
	
	private int [] buildIndexMap(List<?> entries) {
		int [] map = new int[entries.size()];
		Arrays.fill(map, -1);
		int next = 0;
		for(int i=0;i<map.length;i++) {
			if(entries.get(i)!=null) map[i] = next++;
		}
		return map;
	}
	
	/**
	 * Removes all nodes, edges and links. All references obtained before become invalid
	 */
	public void clear() {
		for(TreeNode<N,E> node:nodes) if(node!=null) node.detach();
		for(TreeEdge<N,E> edge:edges) if(edge!=null) edge.detach();
		for(TreeLink<N,E> link:links) if(link!=null) link.detach();
		nodes.clear();
		edges.clear();
		links.clear();
		numNodes = numEdges = numLinks = 0;
		rootIndex = -1;
		modificationCount++;
	}
	
	/**
	 * Checks the structural invariants of the tree. Every violation is reported as a warning in the log
	 * @return boolean true if the tree is consistent
	 */
	public boolean validate() {
		List<String> problems = new ArrayList<>();
		int [] linksPerNode = new int[nodes.size()];
		int liveLinks = 0;
		for(TreeLink<N,E> link:links) {
			if(link==null) continue;
			liveLinks++;
			int idx = link.getIndex();
			TreeLink<N,E> outer = entryAt(links, link.getOuterIndex());
			TreeLink<N,E> next = entryAt(links, link.getNextIndex());
			TreeNode<N,E> node = entryAt(nodes, link.getNodeIndex());
			TreeEdge<N,E> edge = entryAt(edges, link.getEdgeIndex());
			if(outer==null || outer.getOuterIndex()!=idx) problems.add("Outer of the outer of link "+idx+" is not the same link");
			if(next==null || next.getNodeIndex()!=link.getNodeIndex()) problems.add("Next of link "+idx+" does not belong to the same node");
			if(node==null) problems.add("Link "+idx+" points to invalid node "+link.getNodeIndex());
			else linksPerNode[node.getIndex()]++;
			if(edge==null || (edge.getPrimaryLinkIndex()!=idx && edge.getSecondaryLinkIndex()!=idx)) problems.add("Edge of link "+idx+" does not point back to the link");
			if(outer!=null && outer.getNodeIndex()==link.getNodeIndex()) problems.add("Link "+idx+" and its outer link belong to the same node");
		}
		if(liveLinks!=numLinks) problems.add("Expected "+numLinks+" links but found "+liveLinks);
		if(numLinks!=2*numEdges) problems.add("Number of links "+numLinks+" is not twice the number of edges "+numEdges);
		for(TreeEdge<N,E> edge:edges) {
			if(edge==null) continue;
			TreeLink<N,E> primary = entryAt(links, edge.getPrimaryLinkIndex());
			TreeLink<N,E> secondary = entryAt(links, edge.getSecondaryLinkIndex());
			if(primary==null || secondary==null || primary==secondary) problems.add("Edge "+edge.getIndex()+" does not have two distinct links");
		}
		for(TreeNode<N,E> node:nodes) {
			if(node==null) continue;
			int expected = linksPerNode[node.getIndex()];
			int first = node.getLinkIndex();
			if(first<0) {
				if(expected>0) problems.add("Node "+node.getIndex()+" has "+expected+" links but does not point to any of them");
				continue;
			}
			TreeLink<N,E> current = entryAt(links, first);
			int steps = 0;
			while (current!=null && steps<=expected) {
				steps++;
				current = entryAt(links, current.getNextIndex());
				if(current!=null && current.getIndex()==first) break;
			}
			if(current==null || current.getIndex()!=first || steps!=expected) problems.add("Circular list of links of node "+node.getIndex()+" does not close after "+expected+" steps");
		}
		if(problems.isEmpty() && numNodes>0) {
			if(numEdges!=numNodes-1) problems.add("Tree with "+numNodes+" nodes has "+numEdges+" edges");
			else {
				try {
					if(new TreeOrientation<>(this, getRoot()).getReachableCount()!=numNodes) problems.add("Not all nodes are reachable from the root");
				} catch (StructureException e) {
					problems.add(e.getReason());
				}
			}
		}
		for(String problem:problems) log.warning(problem);
		return problems.isEmpty();
	}
	
	private <T> T entryAt(List<T> entries, int index) {
		if(index<0 || index>=entries.size()) return null;
		return entries.get(index);
	}
	
	/**
	 * @return String with one line per node describing its data and adjacent nodes
	 */
	public String dump() {
		StringBuilder answer = new StringBuilder();
		for(TreeNode<N,E> node:nodes) {
			if(node==null) continue;
			answer.append("Node ").append(node.getIndex());
			if(node.getIndex()==rootIndex) answer.append(" (root)");
			answer.append(" data: ").append(node.getData());
			answer.append(" neighbors:");
			for(TreeLink<N,E> link:getLinksAround(node)) {
				TreeEdge<N,E> edge = edges.get(link.getEdgeIndex());
				answer.append(" ").append(links.get(link.getOuterIndex()).getNodeIndex());
				answer.append("[").append(edge.getData()).append("]");
			}
			answer.append("\n");
		}
		return answer.toString();
	}
}
