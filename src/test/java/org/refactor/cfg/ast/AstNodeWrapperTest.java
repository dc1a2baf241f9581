package org.refactor.cfg.ast;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refactor.cfg.Fixtures;

import java.util.List;
import java.util.Map;

@RunWith(JUnit4.class)
public class AstNodeWrapperTest {

    @Test
    public void childWrappersAreCachedAndKnowTheirParent() {
        AstNodeWrapper root = Fixtures.ast("/ast/while.json");
        AstNodeWrapper body = root.child("body");
        Assert.assertSame(body, root.child("body"));
        Assert.assertSame(root, body.parent());

        AstNodeWrapper statements = body.child("statements");
        AstNodeWrapper first = statements.child(0);
        Assert.assertSame(first, statements.child(0));
        Assert.assertSame(statements, first.parent());
        Assert.assertNull(statements.child(1));
        Assert.assertNull(root.child(0));
        Assert.assertNull(statements.child("x"));
    }

    @Test
    public void typeTagAndScalars() {
        AstNodeWrapper root = Fixtures.ast("/ast/while.json");
        Assert.assertEquals("while_loop", root.typeTag());
        Assert.assertEquals("i", root.child("condition").child("left").stringProperty("name"));
        Assert.assertEquals("10", root.child("condition").child("right").child("value").stringValue());
        Assert.assertNull(root.child("body").child("statements").typeTag());
    }

    @Test
    public void siblingsAndIndex() {
        AstNodeWrapper root = Fixtures.ast("/ast/if_else.json");
        AstNodeWrapper branches = root.child("branches");
        AstNodeWrapper first = branches.child(0);
        AstNodeWrapper second = branches.child(1);

        Assert.assertEquals(1, branches.indexOf(second));
        Assert.assertEquals(-1, branches.indexOf(root));
        Assert.assertSame(second, first.nextSibling());
        Assert.assertNull(second.nextSibling());
        // 父节点不是列表
        Assert.assertNull(root.child("branches").nextSibling());
    }

    @Test
    public void childrenFollowSourceOrder() {
        AstNodeWrapper root = Fixtures.parse("{\"type\": \"t\", \"b\": {\"type\": \"x\"}, \"a\": [1, 2], \"n\": null}");
        List<AstNodeWrapper> children = root.children();
        Assert.assertEquals(3, children.size());
        Assert.assertEquals("t", children.get(0).stringValue());
        Assert.assertEquals("x", children.get(1).typeTag());
        Assert.assertTrue(children.get(2).isArray());
        Assert.assertEquals(2, children.get(2).children().size());
    }

    @Test
    public void describeHandlesEveryShape() {
        AstNodeWrapper root = Fixtures.ast("/ast/if_else.json");
        Map<String, Object> d = root.describe();
        Assert.assertEquals("if_statement", d.get("type"));
        Assert.assertEquals("1", d.get("id"));

        Assert.assertEquals("list[2]", root.child("branches").describe().get("type"));
        Map<String, Object> scalar = root.child("type").describe();
        Assert.assertEquals("scalar", scalar.get("type"));
        Assert.assertEquals("if_statement", scalar.get("id"));
    }
}
