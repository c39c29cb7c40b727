package phylotree.tree.test;

import java.util.List;

import junit.framework.TestCase;
import phylotree.tree.StructureException;
import phylotree.tree.Tree;
import phylotree.tree.TreeCollection;
import phylotree.tree.TreeEdge;
import phylotree.tree.TreeLink;
import phylotree.tree.TreeNode;
import phylotree.tree.TreeOrientation;

public class TreeTest extends TestCase {
	
	private Tree<String,Double> tree;
	private TreeNode<String,Double> root;
	private TreeNode<String,Double> a;
	private TreeNode<String,Double> b;
	private TreeNode<String,Double> c;
	private TreeNode<String,Double> d;
	private TreeEdge<String,Double> edgeB;
	
	@Override
	protected void setUp() {
		// r -> a, b ; b -> c, d
		tree = new Tree<>();
		root = tree.addNode("r");
		a = tree.addNode("a");
		b = tree.addNode("b");
		c = tree.addNode("c");
		d = tree.addNode("d");
		tree.addEdge(root, a, 1.0);
		edgeB = tree.addEdge(root, b, 2.0);
		tree.addEdge(b, c, 3.0);
		tree.addEdge(b, d, 4.0);
	}
	
	public void testCounts() {
		assertEquals(5, tree.getNodeCount());
		assertEquals(4, tree.getEdgeCount());
		assertEquals(8, tree.getLinkCount());
		assertSame(root, tree.getRoot());
		assertEquals(2, tree.getDegree(root));
		assertEquals(3, tree.getDegree(b));
		assertEquals(1, a.getDegree());
		assertTrue(tree.isLeaf(c));
		assertFalse(tree.isLeaf(b));
		assertEquals(3, tree.getLeafCount());
		assertTrue(tree.validate());
	}
	
	public void testLinkInvariants() {
		for(TreeLink<String,Double> link:tree.getLinks()) {
			assertSame(link, link.getOuter().getOuter());
			assertSame(link.getNode(), link.getNext().getNode());
			assertNotSame(link.getNode(), link.getOuter().getNode());
		}
		for(TreeNode<String,Double> node:tree.getNodes()) {
			TreeLink<String,Double> first = node.getLink();
			TreeLink<String,Double> current = first;
			int steps = 0;
			do {
				current = current.getNext();
				steps++;
			} while (current != first);
			assertEquals(tree.getDegree(node), steps);
		}
	}
	
	public void testInsertionOrder() {
		List<TreeLink<String,Double>> links = tree.getLinksAround(b);
		assertEquals(3, links.size());
		assertSame(root, links.get(0).getOuter().getNode());
		assertSame(c, links.get(1).getOuter().getNode());
		assertSame(d, links.get(2).getOuter().getNode());
		assertSame(root, edgeB.getPrimaryNode());
		assertSame(b, edgeB.getSecondaryNode());
		assertEquals(2.0, edgeB.getData(), 0.0001);
	}
	
	public void testInvalidEdges() {
		try {
			tree.addEdge(a, a, 0.0);
			fail("Self loop accepted");
		} catch (StructureException e) {
			assertTrue(e.getReason().contains("Self loop"));
		}
		Tree<String,Double> other = new Tree<>();
		TreeNode<String,Double> foreign = other.addNode("x");
		try {
			tree.addEdge(a, foreign, 0.0);
			fail("Node of another tree accepted");
		} catch (StructureException e) {
			// expected
		}
		try {
			tree.addEdge(null, a, 0.0);
			fail("Null node accepted");
		} catch (StructureException e) {
			// expected
		}
		assertEquals(4, tree.getEdgeCount());
	}
	
	public void testEdgesClosingCycles() {
		int mods = tree.getModificationCount();
		assertCycleRejected(c, d);
		assertCycleRejected(a, d);
		assertCycleRejected(d, root);
		assertCycleRejected(b, root);
		assertEquals(4, tree.getEdgeCount());
		assertEquals(8, tree.getLinkCount());
		assertEquals(mods, tree.getModificationCount());
		assertTrue(tree.validate());
		
		TreeNode<String,Double> x = tree.addNode("x");
		TreeNode<String,Double> y = tree.addNode("y");
		tree.addEdge(x, y, 1.0);
		tree.addEdge(d, x, 5.0);
		assertEquals(6, tree.getEdgeCount());
		assertTrue(tree.validate());
		assertCycleRejected(y, a);
	}
	
	private void assertCycleRejected(TreeNode<String,Double> nodeA, TreeNode<String,Double> nodeB) {
		try {
			tree.addEdge(nodeA, nodeB, 0.0);
			fail("Cycle accepted between "+nodeA.getData()+" and "+nodeB.getData());
		} catch (StructureException e) {
			assertTrue(e.getReason().contains("already connected"));
		}
	}
	
	public void testOrientation() {
		TreeOrientation<String,Double> orientation = new TreeOrientation<>(tree, root);
		assertEquals(5, orientation.getReachableCount());
		assertEquals(0, orientation.getDepth(root));
		assertEquals(2, orientation.getDepth(d));
		assertSame(b, orientation.getParent(d));
		assertNull(orientation.getParent(root));
		assertSame(edgeB, orientation.getParentEdge(b));
		List<TreeNode<String,Double>> children = orientation.getChildren(b);
		assertEquals(2, children.size());
		assertSame(c, children.get(0));
		assertSame(d, children.get(1));
		
		TreeOrientation<String,Double> fromC = new TreeOrientation<>(tree, c);
		assertSame(b, fromC.getParent(root));
		assertEquals(3, fromC.getDepth(a));
		assertSame(c, fromC.getPrimaryLink(tree.getEdge(2)).getNode());
	}
	
	public void testSetRoot() {
		int mods = tree.getModificationCount();
		tree.setRoot(b);
		assertSame(b, tree.getRoot());
		assertEquals(mods, tree.getModificationCount());
		// The old root has degree two so it is not a leaf
		assertEquals(3, tree.getLeafCount());
		assertTrue(tree.validate());
	}
	
	public void testRemoveSubtreeAndCompact() {
		tree.removeSubtree(edgeB);
		assertEquals(2, tree.getNodeCount());
		assertEquals(1, tree.getEdgeCount());
		assertEquals(2, tree.getLinkCount());
		assertEquals(5, tree.getNodeSlots());
		assertNull(b.getTree());
		assertEquals(1, tree.getDegree(root));
		try {
			tree.getNode(2);
			fail("Removed node still available");
		} catch (StructureException e) {
			// expected
		}
		assertTrue(tree.validate());
		
		tree.compact();
		assertEquals(2, tree.getNodeSlots());
		assertEquals(1, tree.getEdgeSlots());
		assertEquals(2, tree.getLinkSlots());
		assertNull(a.getTree());
		try {
			tree.getDegree(a);
			fail("Stale reference accepted after compact");
		} catch (StructureException e) {
			// expected
		}
		TreeNode<String,Double> newRoot = tree.getRoot();
		assertEquals("r", newRoot.getData());
		assertEquals("a", newRoot.getLink().getOuter().getNode().getData());
		assertEquals(1.0, tree.getEdge(0).getData(), 0.0001);
		assertTrue(tree.validate());
	}
	
	public void testRemoveLeafEdge() {
		TreeEdge<String,Double> edgeC = tree.getEdge(2);
		tree.removeSubtree(edgeC);
		assertEquals(4, tree.getNodeCount());
		List<TreeLink<String,Double>> links = tree.getLinksAround(b);
		assertEquals(2, links.size());
		assertSame(root, links.get(0).getOuter().getNode());
		assertSame(d, links.get(1).getOuter().getNode());
		assertTrue(tree.validate());
	}
	
	public void testClear() {
		tree.clear();
		assertTrue(tree.isEmpty());
		assertNull(tree.getRoot());
		assertEquals(0, tree.getEdgeCount());
		assertNull(root.getTree());
		TreeNode<String,Double> single = tree.addNode("s");
		assertSame(single, tree.getRoot());
		assertEquals(0, tree.getDegree(single));
		assertNull(single.getLink());
		assertEquals(1, tree.getLeafCount());
		assertTrue(tree.validate());
	}
	
	public void testValidateDetectsDisconnectedNodes() {
		tree.addNode("isolated");
		assertFalse(tree.validate());
	}
	
	public void testDump() {
		String dump = tree.dump();
		assertTrue(dump.startsWith("Node 0 (root) data: r neighbors: 1[1.0] 2[2.0]"));
		assertEquals(5, dump.split("\n").length);
	}
	
	public void testTreeCollection() {
		TreeCollection<String,Double> trees = new TreeCollection<>();
		Tree<String,Double> second = new Tree<>();
		second.addNode("x");
		trees.add("first", tree);
		trees.add("second", second);
		assertEquals(2, trees.size());
		assertSame(second, trees.get("second"));
		assertSame(tree, trees.get(0));
		assertEquals("second", trees.getName(1));
		assertNull(trees.get("third"));
		try {
			trees.add("first", second);
			fail("Duplicated name accepted");
		} catch (IllegalArgumentException e) {
			// expected
		}
		int count = 0;
		for(Tree<String,Double> t:trees) {
			assertNotNull(t);
			count++;
		}
		assertEquals(2, count);
	}
}
