package org.refactor.cfg.graph;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refactor.cfg.spec.Constraints;
import org.refactor.cfg.spec.Effects;
import org.refactor.cfg.spec.TransitionSpec;

import java.util.List;

@RunWith(JUnit4.class)
public class ControlFlowGraphTest {

    private final IdGenerator ids = new IdGenerator("t");

    @Test
    public void newGraphHasOnlyBoundaries() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        Assert.assertEquals(2, g.nodes().size());
        Assert.assertTrue(g.edges().isEmpty());
        Assert.assertEquals("BEGIN", g.beginNode().role);
        Assert.assertEquals("END", g.endNode().role);
        Assert.assertTrue(g.beginNode().id.startsWith("t:BEGIN_"));
    }

    @Test
    public void duplicateEdgesAreNotAdded() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        CfgEdge first = g.connect(g.beginNode(), g.endNode());
        CfgEdge second = g.connect(g.beginNode(), g.endNode());
        Assert.assertSame(first, second);
        Assert.assertEquals(1, g.edges().size());

        g.connect(g.beginNode(), g.endNode(), Constraints.condition(true), null);
        g.connect(g.beginNode(), g.endNode(), Constraints.condition(true), null);
        g.connect(g.beginNode(), g.endNode(), Constraints.condition(false), null);
        Assert.assertEquals(3, g.edges().size());
    }

    @Test
    public void emptyConstraintsCountAsNoConstraints() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        CfgEdge plain = g.connect(g.beginNode(), g.endNode(), null, null);
        CfgEdge empty = g.connect(g.beginNode(), g.endNode(), new Constraints(null, null), null);
        Assert.assertSame(plain, empty);
        Assert.assertNull(plain.constraints);

        TransitionSpec tr = TransitionSpec.of("BEGIN", "END", new Constraints(null, null));
        Assert.assertSame(plain, g.connect(g.beginNode().id, g.endNode().id, null, Metadata.ofTransition(tr)));
        Assert.assertEquals(1, g.edges().size());
    }

    @Test
    public void edgeTakesConstraintsAndEffectsFromItsTransition() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        TransitionSpec tr = TransitionSpec.of("cond", "END", Constraints.condition(false))
                .withEffects(Effects.interruptionStop(Effects.Interruption.BREAK));
        CfgEdge e = g.connect(g.beginNode(), g.endNode(), null, Metadata.ofTransition(tr));
        Assert.assertEquals(Constraints.condition(false), e.constraints);
        Assert.assertEquals(tr.effects(), e.effects);
        Assert.assertFalse(e.isInsignificant());
    }

    @Test
    public void mergingTwiceAddsNothingNew() {
        ControlFlowGraph sub = ControlFlowGraph.trivial("sub", ids);
        sub.addNode("atomic", "a", null);

        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        g.merge(sub);
        int nodes = g.nodes().size();
        int edges = g.edges().size();
        g.merge(sub);
        Assert.assertEquals(nodes, g.nodes().size());
        Assert.assertEquals(edges, g.edges().size());
        Assert.assertEquals(5, nodes);
        Assert.assertEquals(1, edges);
    }

    @Test
    public void subgraphIsWrappedByEnterAndLeave() {
        ControlFlowGraph sub = ControlFlowGraph.trivial("body", ids);
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        NodePair pair = g.addNode("compound", "body", new Metadata(), sub);

        Assert.assertFalse(pair.isAtomic());
        Assert.assertEquals("enter__body", pair.enter().kind);
        Assert.assertEquals("leave__body", pair.leave().kind);
        Assert.assertEquals(List.of(sub.beginNode()), g.successors(pair.enter().id));
        Assert.assertEquals(List.of(sub.endNode()), g.predecessors(pair.leave().id));
        Assert.assertNotNull(g.findEdge(sub.beginNode().id, sub.endNode().id));
        Assert.assertTrue(g.danglingEdges().isEmpty());

        NodePair atom = g.addNode("atomic", "x", null, null);
        Assert.assertTrue(atom.isAtomic());
    }

    @Test
    public void optimizeRemovesPassThroughNodes() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        CfgNode a = g.addNode("atomic", "a", null);
        CfgNode b = g.addNode("atomic", "b", null);
        g.connect(g.beginNode(), a, Constraints.condition(true), null);
        g.connect(a, b);
        g.connect(b, g.endNode());

        Assert.assertEquals(2, g.optimize());
        Assert.assertEquals(2, g.nodes().size());
        Assert.assertEquals(1, g.edges().size());
        CfgEdge e = g.edges().get(0);
        Assert.assertEquals(g.beginNode().id, e.src);
        Assert.assertEquals(g.endNode().id, e.dst);
        Assert.assertEquals(Constraints.condition(true), e.constraints);

        Assert.assertEquals(0, g.optimize());
    }

    @Test
    public void optimizeKeepsNodesBetweenTwoSignificantEdges() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        CfgNode a = g.addNode("atomic", "a", null);
        g.connect(g.beginNode(), a, Constraints.condition(true), null);
        g.connect(a, g.endNode(), Constraints.condition(false), null);
        Assert.assertEquals(0, g.optimize());
        Assert.assertNotNull(g.node(a.id));
    }

    @Test
    public void optimizeKeepsNodesWithMetadataOrEffects() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        Metadata m = new Metadata();
        m.primary = true;
        CfgNode a = g.addNode("atomic", "a", m);
        g.connect(g.beginNode(), a);
        g.connect(a, g.endNode());
        Assert.assertEquals(0, g.optimize());
    }

    @Test
    public void optimizeSkipsSelfLoops() {
        ControlFlowGraph g = new ControlFlowGraph("g", ids);
        CfgNode a = g.addNode("atomic", "a", null);
        g.connect(a, a);
        Assert.assertEquals(0, g.optimize());
    }
}
