package phylotree.tree.traversal.test;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;

import junit.framework.TestCase;
import phylotree.tree.Tree;
import phylotree.tree.TreeNode;
import phylotree.tree.traversal.EulerTourTraversal;
import phylotree.tree.traversal.InorderTraversal;
import phylotree.tree.traversal.LevelorderTraversal;
import phylotree.tree.traversal.PathTraversal;
import phylotree.tree.traversal.PostorderTraversal;
import phylotree.tree.traversal.PreorderTraversal;
import phylotree.tree.traversal.RoundtripTraversal;
import phylotree.tree.traversal.TraversalStep;
import phylotree.tree.traversal.Traversals;
import phylotree.tree.traversal.UnsupportedTopologyException;

public class TraversalsTest extends TestCase {
	
	private Tree<String,Integer> tree;
	private TreeNode<String,Integer> f;
	private TreeNode<String,Integer> b;
	private TreeNode<String,Integer> c;
	private TreeNode<String,Integer> d;
	private TreeNode<String,Integer> e;
	
	@Override
	protected void setUp() {
		// (A,B,(C,D)E)F
		tree = new Tree<>();
		f = tree.addNode("F");
		TreeNode<String,Integer> a = tree.addNode("A");
		b = tree.addNode("B");
		e = tree.addNode("E");
		c = tree.addNode("C");
		d = tree.addNode("D");
		tree.addEdge(f, a, 1);
		tree.addEdge(f, b, 2);
		tree.addEdge(f, e, 3);
		tree.addEdge(e, c, 4);
		tree.addEdge(e, d, 5);
	}
	
	private static String names(List<TreeNode<String,Integer>> nodes) {
		StringBuilder answer = new StringBuilder();
		for(TreeNode<String,Integer> node:nodes) answer.append(node.getData());
		return answer.toString();
	}
	
	public void testPreorder() {
		assertEquals("FABECD", names(Traversals.preorderNodes(tree)));
		List<TraversalStep<String,Integer>> steps = new PreorderTraversal<>(tree).steps();
		assertTrue(steps.get(0).isStart());
		assertNull(steps.get(0).getEdge());
		assertEquals(0, steps.get(0).getDepth());
		TraversalStep<String,Integer> stepE = steps.get(3);
		assertSame(e, stepE.getNode());
		assertEquals(3, stepE.getEdge().getData().intValue());
		assertEquals(1, stepE.getDepth());
		assertSame(e, stepE.getLink().getNode());
		assertEquals(2, steps.get(5).getDepth());
	}
	
	public void testPostorder() {
		assertEquals("ABCDEF", names(Traversals.postorderNodes(tree)));
	}
	
	public void testLevelorder() {
		assertEquals("FABECD", names(Traversals.levelorderNodes(tree)));
		tree.addEdge(b, tree.addNode("G"), 6);
		assertEquals("FABEGCD", names(new LevelorderTraversal<>(tree).nodes()));
	}
	
	public void testInorder() {
		assertEquals("AFBCED", names(Traversals.inorderNodes(tree)));
		tree.addEdge(f, tree.addNode("X"), 6);
		try {
			new InorderTraversal<>(tree).iterator();
			fail("Inorder accepted a node with four edges");
		} catch (UnsupportedTopologyException ex) {
			assertSame(f, ex.getNode());
		}
	}
	
	public void testEulerTour() {
		List<TreeNode<String,Integer>> nodes = Traversals.eulerTourNodes(tree);
		assertEquals(2*tree.getEdgeCount()+1, nodes.size());
		assertEquals("FAFBFECEDEF", names(nodes));
		List<TraversalStep<String,Integer>> steps = new EulerTourTraversal<>(tree).steps();
		// Return from A to F goes through the edge F-A
		assertSame(f, steps.get(2).getNode());
		assertEquals(1, steps.get(2).getEdge().getData().intValue());
		assertFalse(steps.get(2).isFirstVisit());
		assertTrue(steps.get(10).isLastVisit());
	}
	
	public void testRoundtrip() {
		List<String> events = new ArrayList<>();
		for(TraversalStep<String,Integer> step:new RoundtripTraversal<>(tree)) {
			String name = step.getNode().getData();
			if(step.isFirstVisit() && step.isLastVisit()) events.add(name);
			else if (step.isFirstVisit()) events.add("<"+name);
			else events.add(name+">");
		}
		assertEquals("[<F, A, B, <E, C, D, E>, F>]", events.toString());
	}
	
	public void testPath() {
		assertEquals("CEFB", names(Traversals.pathNodes(tree, c, b)));
		assertEquals("BFEC", names(Traversals.pathNodes(tree, b, c)));
		assertEquals("CED", names(Traversals.pathNodes(tree, c, d)));
		assertEquals("FEC", names(Traversals.pathNodes(tree, f, c)));
		assertEquals("CEF", names(Traversals.pathNodes(tree, c, f)));
		assertEquals("C", names(Traversals.pathNodes(tree, c, c)));
		PathTraversal<String,Integer> path = new PathTraversal<>(tree, c, d);
		assertSame(e, path.getLowestCommonAncestor());
		assertSame(f, new PathTraversal<>(tree, c, b).getLowestCommonAncestor());
		List<TraversalStep<String,Integer>> steps = path.steps();
		assertEquals(4, steps.get(1).getEdge().getData().intValue());
		assertEquals(5, steps.get(2).getEdge().getData().intValue());
		assertEquals(2, steps.get(2).getDepth());
	}
	
	public void testStartAtInternalNode() {
		List<TraversalStep<String,Integer>> steps = new PreorderTraversal<>(tree, e).steps();
		StringBuilder order = new StringBuilder();
		for(TraversalStep<String,Integer> step:steps) order.append(step.getNode().getData());
		assertEquals("EFABCD", order.toString());
		assertEquals(2, steps.get(2).getDepth());
		assertEquals("ABFCDE", names(new PostorderTraversal<>(tree, e).nodes()));
	}
	
	public void testLeaves() {
		assertEquals("ABCD", names(Traversals.leaves(tree)));
	}
	
	public void testRestartable() {
		PreorderTraversal<String,Integer> traversal = new PreorderTraversal<>(tree);
		assertEquals(names(traversal.nodes()), names(traversal.nodes()));
	}
	
	public void testEmptyAndSingleNode() {
		Tree<String,Integer> empty = new Tree<>();
		assertTrue(Traversals.preorderNodes(empty).isEmpty());
		assertTrue(Traversals.eulerTourNodes(empty).isEmpty());
		Tree<String,Integer> single = new Tree<>();
		single.addNode("S");
		assertEquals("S", names(Traversals.postorderNodes(single)));
		assertEquals("S", names(Traversals.eulerTourNodes(single)));
		assertEquals("S", names(Traversals.leaves(single)));
	}
	
	public void testFailFast() {
		Iterator<TraversalStep<String,Integer>> it = new PreorderTraversal<>(tree).iterator();
		it.next();
		tree.addEdge(b, tree.addNode("G"), 6);
		try {
			it.next();
			fail("Modification during traversal not detected");
		} catch (ConcurrentModificationException ex) {
			// expected
		}
		try {
			new PreorderTraversal<>(tree).iterator().remove();
			fail("Remove should not be supported");
		} catch (UnsupportedOperationException ex) {
			// expected
		}
	}
}
