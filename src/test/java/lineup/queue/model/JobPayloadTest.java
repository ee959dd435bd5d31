package lineup.queue.model;

import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JobPayloadTest {

    public static class Resize {
        public String image;
        public int width;
    }

    @Test
    void bytesAreCopied() {
        byte[] raw = { 1, 2, 3 };
        JobPayload payload = JobPayload.of("blob", raw);
        raw[0] = 9;

        byte[] data = payload.data();
        assertEquals(1, data[0]);
        data[1] = 9;
        assertEquals(2, payload.data()[1]);
        assertEquals(3, payload.size());
    }

    @Test
    void typeIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> JobPayload.ofText(" ", "x"));
        assertThrows(IllegalArgumentException.class, () -> JobPayload.of(null, new byte[0]));
    }

    @Test
    void jsonPayload() {
        JobPayload payload = JobPayload.json("resize", Map.of("image", "cat.png", "width", 640));
        Resize resize = payload.readJson(Resize.class);

        assertEquals("resize", payload.type());
        assertEquals("cat.png", resize.image);
        assertEquals(640, resize.width);
    }

    @Test
    void unreadableJsonIsReported() {
        JobPayload payload = JobPayload.ofText("resize", "not json");
        assertThrows(UncheckedIOException.class, () -> payload.readJson(Resize.class));
    }

    @Test
    void equalityUsesContent() {
        assertEquals(JobPayload.ofText("t", "abc"), JobPayload.ofText("t", "abc"));
        assertNotEquals(JobPayload.ofText("t", "abc"), JobPayload.ofText("u", "abc"));
    }
}
