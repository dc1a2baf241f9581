package org.refactor.cfg;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import org.refactor.cfg.ast.AstNodeWrapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * 测试用的 classpath 资源读取。
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static JsonElement json(String resource) {
        InputStream in = Fixtures.class.getResourceAsStream(resource);
        if (in == null) throw new IllegalArgumentException("missing test resource " + resource);
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static AstNodeWrapper ast(String resource) {
        return AstNodeWrapper.root(json(resource));
    }

    public static AstNodeWrapper parse(String json) {
        return AstNodeWrapper.root(JsonParser.parseString(json));
    }
}
