package io.github.yok.toonlink.serializer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import io.github.yok.toonlink.model.Value;
import org.junit.jupiter.api.Test;

class ValueRendererTest {

    @Test
    void render_正常ケース_Nullを指定する_空文字が返ること() {
        assertEquals("", ValueRenderer.render(Value.ofNull()));
    }

    @Test
    void render_正常ケース_Boolを指定する_小文字の真偽値が返ること() {
        assertEquals("true", ValueRenderer.render(Value.ofBool(true)));
        assertEquals("false", ValueRenderer.render(Value.ofBool(false)));
    }

    @Test
    void render_正常ケース_Intを指定する_10進表記が返ること() {
        assertEquals("30", ValueRenderer.render(Value.ofInt(30L)));
        assertEquals("-9223372036854775808", ValueRenderer.render(Value.ofInt(Long.MIN_VALUE)));
    }

    @Test
    void render_正常ケース_Floatを指定する_小数点付きの表記が返ること() {
        assertEquals("95000.0", ValueRenderer.render(Value.ofFloat(95000.0)));
        assertEquals("30.0", ValueRenderer.render(Value.ofFloat(30.0)));
        assertEquals("1.0E20", ValueRenderer.render(Value.ofFloat(1e20)));
        assertEquals("-0.0", ValueRenderer.render(Value.ofFloat(-0.0)));
        assertEquals("Infinity", ValueRenderer.render(Value.ofFloat(Double.POSITIVE_INFINITY)));
    }

    @Test
    void render_正常ケース_NaNを指定する_空文字が返ること() {
        assertEquals("", ValueRenderer.render(Value.ofFloat(Double.NaN)));
    }

    @Test
    void render_正常ケース_Stringを指定する_そのまま返ること() {
        assertEquals("  spaced  ", ValueRenderer.render(Value.ofString("  spaced  ")));
        assertEquals("30", ValueRenderer.render(Value.ofString("30")));
    }
}
