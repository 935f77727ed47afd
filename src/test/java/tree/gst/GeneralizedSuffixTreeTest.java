package tree.gst;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

import static tree.gst.TreePaths.INSIDE_EDGE;
import static tree.gst.TreePaths.NOT_A_PATH;
import static tree.gst.TreePaths.codes;
import static tree.gst.TreePaths.isPath;
import static tree.gst.TreePaths.walk;

public class GeneralizedSuffixTreeTest {

    private static void assertAllSuffixesArePaths(GeneralizedSuffixTree tree, String s) {
        for (int i = 0; i < s.length(); i++) {
            Assert.assertTrue("suffix " + s.substring(i) + " of " + s, isPath(tree, s.substring(i)));
        }
    }

    private static void assertValid(GeneralizedSuffixTree tree) {
        Assert.assertEquals(Collections.emptyList(), TreeVerifier.verify(tree));
    }

    @Test
    public void newTree_wiresRootAndSink() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        Assert.assertEquals(2, tree.nodeCount());
        Assert.assertEquals(tree.sink(), tree.suffixLink(tree.root()));
        Assert.assertEquals(tree.root(), tree.suffixLink(tree.sink()));
        Assert.assertNull(tree.getEdge(tree.root(), 'a'));

        Edge fromSink = tree.getEdge(tree.sink(), 'q');
        Assert.assertEquals(tree.root(), fromSink.getTarget());
        Assert.assertEquals(1, tree.edgeLength(fromSink));
        Assert.assertSame(fromSink, tree.getEdge(tree.sink(), 12345));
        Assert.assertEquals(0, tree.childCount(tree.sink()));
        assertValid(tree);
    }

    @Test
    public void addString_assignsSequentialIds() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        Assert.assertEquals(1, tree.addString("abc"));
        Assert.assertEquals(2, tree.addString("xyz"));
        Assert.assertEquals(3, tree.addString("abd"));
        Assert.assertEquals(3, tree.stringCount());
        assertValid(tree);
    }

    @Test
    public void addString_abab_fullStringEndsAtLeaf() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        Assert.assertEquals(1, tree.addString("abab"));

        int full = walk(tree, "abab");
        Assert.assertTrue(full >= 0);
        Assert.assertTrue(tree.isLeaf(full));
        Assert.assertEquals(1, tree.leafStringId(full));
        Assert.assertEquals(0, tree.leafOffset(full));

        int bab = walk(tree, "bab");
        Assert.assertTrue(tree.isLeaf(bab));
        Assert.assertEquals(1, tree.leafOffset(bab));

        // "ab" and "b" occur twice, so they stay implicit inside the two leaf edges.
        Assert.assertEquals(INSIDE_EDGE, walk(tree, "ab"));
        Assert.assertEquals(INSIDE_EDGE, walk(tree, "b"));
        Assert.assertEquals(NOT_A_PATH, walk(tree, "aa"));
        Assert.assertEquals(NOT_A_PATH, walk(tree, "ababa"));

        Assert.assertEquals(2, tree.childCount(tree.root()));
        Assert.assertEquals(4, tree.nodeCount());
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 1}), TreePaths.leafOffsets(tree, 1));
        assertAllSuffixesArePaths(tree, "abab");
        assertValid(tree);
    }

    @Test
    public void addString_rejectsStringSubsumedByTree() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        Assert.assertEquals(1, tree.addString("xx"));
        Assert.assertEquals(GeneralizedSuffixTree.NO_ID, tree.addString("x"));
        Assert.assertEquals(1, tree.stringCount());
        Assert.assertFalse(tree.containsString(2));

        // The rejected id is handed out again.
        Assert.assertEquals(2, tree.addString("xy"));
        assertAllSuffixesArePaths(tree, "xx");
        assertAllSuffixesArePaths(tree, "xy");
        assertValid(tree);
    }

    @Test
    public void addString_duplicateIsRejectedAndKeepsFirstString() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        Assert.assertEquals(1, tree.addString("banana"));
        int nodes = tree.nodeCount();

        Assert.assertEquals(GeneralizedSuffixTree.NO_ID, tree.addString("banana"));
        Assert.assertEquals(nodes, tree.nodeCount());
        assertAllSuffixesArePaths(tree, "banana");
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 1, 2}), TreePaths.leafOffsets(tree, 1));
        assertValid(tree);
    }

    @Test
    public void addString_sharedPrefixReusesExistingEdges() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        tree.addString("banana");
        Assert.assertEquals(3, tree.childCount(tree.root()));

        Assert.assertEquals(GeneralizedSuffixTree.NO_ID, tree.addString("ana"));
        Assert.assertEquals(3, tree.childCount(tree.root()));
        Assert.assertEquals(5, tree.nodeCount());
        assertAllSuffixesArePaths(tree, "ana");
    }

    @Test
    public void addString_bandanaSplitsBananaEdges() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree(
                SuffixTreeConfiguration.builder().collectStats(true).build());
        Assert.assertEquals(1, tree.addString("banana"));
        Assert.assertEquals(2, tree.addString("bandana"));

        Assert.assertEquals(4, tree.childCount(tree.root()));
        int ban = walk(tree, "ban");
        Assert.assertTrue(ban >= 0);
        Assert.assertFalse(tree.isLeaf(ban));
        Assert.assertEquals(2, tree.childCount(ban));
        Assert.assertEquals(walk(tree, "an"), tree.suffixLink(ban));
        Assert.assertEquals(walk(tree, "n"), tree.suffixLink(walk(tree, "an")));
        Assert.assertEquals(tree.root(), tree.suffixLink(walk(tree, "n")));

        Assert.assertEquals(12, tree.nodeCount());
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 1, 2, 3}), TreePaths.leafOffsets(tree, 2));
        Assert.assertEquals(3, tree.stats().splitCount());
        Assert.assertEquals(7, tree.stats().leafCount());
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 3}), tree.stats().resumePositions());

        assertAllSuffixesArePaths(tree, "banana");
        assertAllSuffixesArePaths(tree, "bandana");
        Assert.assertFalse(isPath(tree, "nad"));
        assertValid(tree);
    }

    @Test
    public void addString_continuesPastEndOfEarlierString() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree(
                SuffixTreeConfiguration.builder().collectStats(true).build());
        Assert.assertEquals(1, tree.addString("ab"));
        Assert.assertEquals(2, tree.addString("abc"));

        int ab = walk(tree, "ab");
        int b = walk(tree, "b");
        Assert.assertTrue(tree.isLeaf(ab));
        Assert.assertEquals(1, tree.leafStringId(ab));
        Assert.assertEquals(1, tree.childCount(ab));
        Assert.assertEquals(b, tree.suffixLink(ab));
        Assert.assertEquals(tree.root(), tree.suffixLink(b));

        int c = walk(tree, "c");
        Assert.assertEquals(2, tree.leafStringId(c));
        Assert.assertEquals(2, tree.leafOffset(c));
        Assert.assertEquals(IntArrayList.wrap(new int[]{0, 1, 2}), TreePaths.leafOffsets(tree, 2));
        Assert.assertEquals(2, tree.stats().rescanCount());
        assertAllSuffixesArePaths(tree, "abc");
        assertValid(tree);
    }

    @Test
    public void addString_mississippiLeavesCoverNonNestedSuffixes() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        tree.addString("mississippi");

        // Only the final "i" also occurs earlier, so it is the one suffix without a leaf.
        IntArrayList expected = new IntArrayList();
        for (int i = 0; i < 10; i++) {
            expected.add(i);
        }
        Assert.assertEquals(expected, TreePaths.leafOffsets(tree, 1));
        assertAllSuffixesArePaths(tree, "mississippi");
        Assert.assertFalse(isPath(tree, "sss"));
        assertValid(tree);
    }

    @Test
    public void addString_emptyStringIsRejected() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        Assert.assertEquals(GeneralizedSuffixTree.NO_ID, tree.addString(""));
        Assert.assertEquals(GeneralizedSuffixTree.NO_ID, tree.addString(new int[0]));
        Assert.assertEquals(0, tree.stringCount());
        Assert.assertEquals(1, tree.addString("a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void addString_disallowsNull() {
        new GeneralizedSuffixTree().addString((int[]) null);
    }

    @Test
    public void addString_charSequenceMatchesCodeUnits() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        int id = tree.addString(new StringBuilder("héllo"));
        Assert.assertArrayEquals(codes("héllo"), tree.getString(id));
        Assert.assertEquals(GeneralizedSuffixTree.NO_ID, tree.addString(codes("llo")));
    }

    @Test
    public void getString_returnsCopy() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        int[] input = {3, 1, 4, 1, 5};
        int id = tree.addString(input);
        input[0] = 9;
        int[] copy = tree.getString(id);
        Assert.assertEquals(3, copy[0]);
        copy[1] = 9;
        Assert.assertEquals(1, tree.symbolAt(id, 1));
        Assert.assertEquals(5, tree.stringLength(id));
    }

    @Test
    public void getString_unknownIdIsRejected() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        tree.addString("abc");
        try {
            tree.getString(2);
            Assert.fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
        }
        try {
            tree.getEdge(99, 'a');
            Assert.fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException ex) {
        }
    }

    @Test
    public void release_freesEveryNodeOnce() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        tree.addString("banana");
        tree.addString("ana");
        tree.addString("bandana");
        tree.addString("band");
        int nodes = tree.nodeCount();

        Assert.assertEquals(nodes - 2, tree.release());
        Assert.assertTrue(tree.isReleased());
        Assert.assertEquals(2, tree.nodeCount());
        Assert.assertEquals(0, tree.stringCount());
        Assert.assertEquals(tree.sink(), tree.suffixLink(tree.root()));
        Assert.assertEquals(0, tree.release());
    }

    @Test(expected = IllegalStateException.class)
    public void addString_afterReleaseFails() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        tree.addString("abc");
        tree.release();
        tree.addString("abd");
    }

    @Test
    public void release_handlesDeepTrees() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        StringBuilder sb = new StringBuilder();
        for (int k = 1; k <= 1500; k++) {
            sb.append('a');
            Assert.assertEquals(k, tree.addString(sb + "b"));
        }
        Assert.assertTrue(walk(tree, sb.substring(1)) >= 0);
        assertValid(tree);
        Assert.assertEquals(tree.nodeCount() - 2, tree.release());
    }

    @Test
    public void verifyInvariants_runsAfterEveryInsertion() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree(SuffixTreeConfiguration.builder()
                .verifyInvariants(true)
                .initialNodeCapacity(4)
                .expectedStrings(1)
                .build());
        String[] words = {"cacao", "cocoa", "acacia", "coca", "accra", "caca"};
        for (String word : words) {
            tree.addString(word);
        }
        for (String word : words) {
            assertAllSuffixesArePaths(tree, word);
        }
    }

    @Test
    public void stats_countAcceptedAndRejected() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree(
                SuffixTreeConfiguration.builder().collectStats(true).build());
        tree.addString("abab");
        tree.addString("ab");
        tree.addString("abba");

        SuffixTreeStats stats = tree.stats();
        Assert.assertEquals(2, stats.acceptedCount());
        Assert.assertEquals(1, stats.rejectedCount());
        Assert.assertTrue(stats.summary().startsWith("accepted=2 rejected=1"));

        stats.setCollecting(false);
        Assert.assertEquals(0, stats.acceptedCount());
        tree.addString("bbb");
        Assert.assertEquals(0, stats.acceptedCount());
    }

    @Test
    public void stats_offByDefault() {
        GeneralizedSuffixTree tree = new GeneralizedSuffixTree();
        tree.addString("abcabc");
        Assert.assertFalse(tree.stats().isCollecting());
        Assert.assertEquals(0, tree.stats().leafCount());
        Assert.assertEquals(0.0, tree.stats().averageInsertTimeMillis(), 0.0);
    }
}
