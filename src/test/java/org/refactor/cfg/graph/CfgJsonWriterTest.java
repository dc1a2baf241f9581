package org.refactor.cfg.graph;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refactor.cfg.Fixtures;
import org.refactor.cfg.spec.ActionKind;
import org.refactor.cfg.spec.ActionSpec;
import org.refactor.cfg.spec.Constraints;
import org.refactor.cfg.spec.Effects;

import java.util.List;

@RunWith(JUnit4.class)
public class CfgJsonWriterTest {

    @Test
    public void nodesAndEdgesAreWritten() {
        IdGenerator ids = new IdGenerator();
        ControlFlowGraph g = new ControlFlowGraph("while_loop", ids);
        Metadata meta = new Metadata();
        meta.wrappedAst = Fixtures.ast("/ast/while.json").child("condition");
        meta.primary = true;
        CfgNode cond = g.addNode("atomic", "cond", meta);
        g.connect(g.beginNode(), cond);
        g.connect(cond, g.endNode(), Constraints.condition(false), null);

        JsonObject json = new CfgJsonWriter().toJsonTree(g);
        Assert.assertEquals("while_loop", json.get("name").getAsString());
        Assert.assertEquals(g.beginNode().id, json.get("begin").getAsString());

        JsonArray nodes = json.getAsJsonArray("nodes");
        Assert.assertEquals(3, nodes.size());
        JsonObject condJson = nodes.get(2).getAsJsonObject();
        Assert.assertEquals("cond", condJson.get("role").getAsString());
        Assert.assertEquals("lt_operator", condJson.getAsJsonObject("ast").get("type").getAsString());
        Assert.assertTrue(condJson.get("primary").getAsBoolean());

        JsonArray edges = json.getAsJsonArray("edges");
        Assert.assertEquals(2, edges.size());
        Assert.assertFalse(edges.get(0).getAsJsonObject().has("constraints"));
        Assert.assertFalse(edges.get(1).getAsJsonObject()
                .getAsJsonObject("constraints").get("condition_value").getAsBoolean());
    }

    @Test
    public void effectsUseSnakeCaseNames() {
        ControlFlowGraph g = new ControlFlowGraph("call", new IdGenerator());
        Metadata meta = new Metadata();
        meta.abstractAction = ActionSpec.of("func", ActionKind.COMPOUND)
                .withEffects(List.of(Effects.callStack(Effects.CallStack.ADD_FRAME)));
        g.addNode("compound", "func", meta);

        String text = new CfgJsonWriter().toJson(g);
        JsonObject json = JsonParser.parseString(text).getAsJsonObject();
        JsonObject node = json.getAsJsonArray("nodes").get(2).getAsJsonObject();
        Assert.assertEquals("add_frame",
                node.getAsJsonArray("effects").get(0).getAsJsonObject().get("call_stack").getAsString());
    }
}
