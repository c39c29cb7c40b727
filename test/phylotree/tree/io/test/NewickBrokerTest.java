package phylotree.tree.io.test;

import java.util.List;

import junit.framework.TestCase;
import phylotree.main.io.LexerToken;
import phylotree.main.io.ParseUtils;
import phylotree.tree.Tree;
import phylotree.tree.TreeNode;
import phylotree.tree.io.DefaultEdgeData;
import phylotree.tree.io.DefaultNodeData;
import phylotree.tree.io.MalformedNewickException;
import phylotree.tree.io.NewickBroker;
import phylotree.tree.io.NewickBrokerElement;
import phylotree.tree.io.NewickLexer;
import phylotree.tree.io.NewickParser;
import phylotree.tree.traversal.Traversals;

public class NewickBrokerTest extends TestCase {
	
	private static NewickBrokerElement element(String name, int depth, double length) {
		NewickBrokerElement element = new NewickBrokerElement(depth);
		element.setName(name);
		element.setBranchLength(length);
		return element;
	}
	
	private NewickBroker parse(String text) throws MalformedNewickException {
		NewickLexer lexer = new NewickLexer();
		return new NewickParser().parse(lexer.analyze(text));
	}
	
	public void testParserDepths() throws Exception {
		NewickBroker broker = parse("(A,B,(C,D)E)F;");
		assertEquals(6, broker.size());
		String [] names = {"F", "A", "B", "E", "C", "D"};
		int [] depths = {0, 1, 1, 1, 2, 2};
		for(int i=0;i<names.length;i++) {
			assertEquals(names[i], broker.get(i).getName());
			assertEquals(depths[i], broker.get(i).getDepth());
		}
		assertTrue(broker.isLeaf(1));
		assertFalse(broker.isLeaf(3));
		assertTrue(broker.isLeaf(5));
		assertEquals(2, broker.getMaxDepth());
		assertNull(broker.getTreeName());
	}
	
	public void testParserAnnotations() throws Exception {
		NewickBroker broker = parse("[lead](A[x]{1}:0.5,B)'root node':1.5[y];");
		NewickBrokerElement root = broker.get(0);
		assertEquals("root node", root.getName());
		assertEquals(1.5, root.getBranchLength(), 0.0000001);
		assertEquals(2, root.getComments().size());
		assertEquals("lead", root.getComments().get(0));
		assertEquals("y", root.getComments().get(1));
		NewickBrokerElement a = broker.get(1);
		assertEquals("x", a.getComments().get(0));
		assertEquals("1", a.getTags().get(0));
		assertEquals(0.5, a.getBranchLength(), 0.0000001);
		assertEquals(1, a.getLine());
		assertEquals(8, a.getColumn());
		assertFalse(broker.get(2).hasBranchLength());
	}
	
	public void testParserDisabledAnnotations() throws Exception {
		NewickLexer lexer = new NewickLexer();
		NewickParser parser = new NewickParser();
		parser.setReadComments(false);
		parser.setReadTags(false);
		NewickBroker broker = parser.parse(lexer.analyze("(A[x]{1},B);"));
		assertTrue(broker.get(1).getComments().isEmpty());
		assertTrue(broker.get(1).getTags().isEmpty());
	}
	
	public void testParserCommentsBeforeBranchLength() throws Exception {
		NewickBroker broker = parse("(A:[c]0.5,B: [d] [e] 2)R:[f]1;");
		NewickBrokerElement a = broker.get(1);
		assertEquals(0.5, a.getBranchLength(), 0);
		assertEquals(1, a.getComments().size());
		assertEquals("c", a.getComments().get(0));
		NewickBrokerElement b = broker.get(2);
		assertEquals(2, b.getBranchLength(), 0);
		assertEquals("d", b.getComments().get(0));
		assertEquals("e", b.getComments().get(1));
		assertEquals(1, broker.get(0).getBranchLength(), 0);
		assertEquals("f", broker.get(0).getComments().get(0));
		
		NewickParser parser = new NewickParser();
		parser.setReadComments(false);
		broker = parser.parse(new NewickLexer().analyze("(A:[c]0.5,B);"));
		assertEquals(0.5, broker.get(1).getBranchLength(), 0);
		assertTrue(broker.get(1).getComments().isEmpty());
	}
	
	public void testParserEmptyLeaves() throws Exception {
		NewickBroker broker = parse("(,(,));");
		assertEquals(5, broker.size());
		for(NewickBrokerElement element:broker) assertEquals("", element.getName());
		assertEquals(2, broker.get(3).getDepth());
		
		broker = parse(";");
		assertEquals(1, broker.size());
		assertEquals(0, broker.get(0).getDepth());
	}
	
	public void testParserErrors() {
		assertMalformed("(A,B));", 1, 6);
		assertMalformed("A,B;", 1, 2);
		assertMalformed("(A:x,B);", 1, 4);
		assertMalformed("(A:,B);", 1, 4);
		assertMalformed("(A:1:2,B);", 1, 5);
		assertMalformed("(A B,C);", 1, 4);
		assertMalformed("(A,B)C D;", 1, 8);
		assertMalformed("(A,B)", 1, 6);
		assertMalformed("(A,B);C;", 1, 7);
		assertMalformed("(A,B", 1, 5);
		assertMalformed("A(B);", 1, 2);
		assertMalformed("(A:[c],B);", 1, 7);
		assertMalformed("(A:1e999,B);", 1, 4);
		assertMalformed("(A:-1e999,B);", 1, 5);
		assertMalformed("(A:1,B:[x]2e400);", 1, 11);
	}
	
	private void assertMalformed(String text, int line, int column) {
		try {
			parse(text);
			fail("Malformed text accepted: "+text);
		} catch (MalformedNewickException e) {
			assertEquals("Wrong line for "+text, line, e.getLine());
			assertEquals("Wrong column for "+text+": "+e.getMessage(), column, e.getColumn());
			assertNotNull(e.getReason());
		}
	}
	
	public void testParseTrees() throws Exception {
		NewickLexer lexer = new NewickLexer();
		List<LexerToken> tokens = lexer.analyze("first = (A,B);\n(C,D);\n'third tree' = E;\n");
		List<NewickBroker> brokers = new NewickParser().parseTrees(tokens);
		assertEquals(3, brokers.size());
		assertEquals("first", brokers.get(0).getTreeName());
		assertNull(brokers.get(1).getTreeName());
		assertEquals("C", brokers.get(1).get(1).getName());
		assertEquals("third tree", brokers.get(2).getTreeName());
		assertEquals("E", brokers.get(2).get(0).getName());
	}
	
	public void testToTree() throws Exception {
		NewickBroker broker = new NewickBroker();
		broker.add(element("F", 0, Double.NaN));
		broker.add(element("A", 1, 1));
		broker.add(element("E", 1, 2));
		broker.add(element("C", 2, 3));
		broker.add(element("D", 2, 4));
		broker.add(element("B", 1, 5));
		Tree<DefaultNodeData,DefaultEdgeData> tree = broker.toTree(DefaultNodeData.FACTORY, DefaultEdgeData.FACTORY);
		assertEquals(6, tree.getNodeCount());
		assertEquals(5, tree.getEdgeCount());
		StringBuilder order = new StringBuilder();
		for(TreeNode<DefaultNodeData,DefaultEdgeData> node:Traversals.preorderNodes(tree)) order.append(node.getData().getName());
		assertEquals("FAECDB", order.toString());
		TreeNode<DefaultNodeData,DefaultEdgeData> b = tree.getNode(5);
		assertEquals("B", b.getData().getName());
		assertEquals(5, b.getLink().getEdge().getData().getBranchLength(), 0.0000001);
		assertTrue(tree.validate());
	}
	
	public void testInvalidDepths() {
		NewickBroker broker = new NewickBroker();
		broker.add(element("A", 1, 1));
		assertInvalidDepths(broker);
		broker = new NewickBroker();
		broker.add(element("A", 0, 1));
		broker.add(element("B", 2, 1));
		assertInvalidDepths(broker);
		broker = new NewickBroker();
		broker.add(element("A", 0, 1));
		broker.add(element("B", 1, 1));
		broker.add(element("C", 0, 1));
		assertInvalidDepths(broker);
	}
	
	private void assertInvalidDepths(NewickBroker broker) {
		try {
			broker.toTree(DefaultNodeData.FACTORY, DefaultEdgeData.FACTORY);
			fail("Invalid depths accepted");
		} catch (MalformedNewickException e) {
			// expected
		}
	}
	
	public void testToNewick() {
		NewickBroker broker = new NewickBroker();
		broker.add(element("R", 0, Double.NaN));
		broker.add(element("X", 1, 0.25));
		broker.add(element("A", 2, 1));
		broker.add(element("B", 2, 1.1234567));
		broker.add(element("C", 1, Double.NaN));
		assertEquals("((A:1,B:1.123457)X:0.25,C)R", broker.toNewick(true, true, false, false, 6));
		assertEquals("((A:1,B:1.1234567)X:0.25,C)R", broker.toNewick(true, true, false, false, ParseUtils.EXACT_PRECISION));
		assertEquals("((A,B)X,C)R", broker.toNewick(true, false, false, false, 6));
		assertEquals("((:1,:1.12):0.25,)", broker.toNewick(false, true, false, false, 2));
		broker.get(2).addComment("c1");
		broker.get(2).addTag("t1");
		assertEquals("((A{t1}[c1],B)X,C)R", broker.toNewick(true, false, true, true, 6));
		assertEquals("((A[c1],B)X,C)R", broker.toNewick(true, false, true, false, 6));
	}
	
	public void testQuoteName() {
		assertEquals("Homo_sapiens", NewickBroker.quoteName("Homo_sapiens"));
		assertEquals("'Homo sapiens'", NewickBroker.quoteName("Homo sapiens"));
		assertEquals("'a:b'", NewickBroker.quoteName("a:b"));
		assertEquals("'it\\'s'", NewickBroker.quoteName("it's"));
		assertEquals("'a\\\\b,c'", NewickBroker.quoteName("a\\b,c"));
		assertEquals("", NewickBroker.quoteName(""));
	}
}
