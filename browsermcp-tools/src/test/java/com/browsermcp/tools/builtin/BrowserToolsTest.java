package com.browsermcp.tools.builtin;

import com.browsermcp.common.errors.HandlerException;
import com.browsermcp.tools.CallToolResult;
import com.browsermcp.tools.Content;
import com.browsermcp.tools.FakeExtensionClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BrowserToolsTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final String PAGE_TEXT = "- Page URL: https://example.com/\n"
            + "- Page Title: Example Domain\n"
            + "- Page Snapshot\n"
            + "```yaml\n"
            + "- heading \"Example Domain\" [ref=s1e3]\n"
            + "```\n";

    private static FakeExtensionClient page() {
        return new FakeExtensionClient().withPage("https://example.com/", "Example Domain",
                "- heading \"Example Domain\" [ref=s1e3]");
    }

    private static JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Nested
    class Common {

        @Test
        void wait_rendersIntegralSecondsWithoutFraction() throws Exception {
            FakeExtensionClient client = new FakeExtensionClient();

            CallToolResult result = CommonTools.waitFor().execute(client, json("{\"time\":1.0}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals("Waited for 1 seconds", result.firstText());
            assertEquals("browser_wait", client.calls.get(0).type());
        }

        @Test
        void wait_keepsFractionalSeconds() throws Exception {
            CallToolResult result = CommonTools.waitFor()
                    .execute(new FakeExtensionClient(), json("{\"time\":1.5}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals("Waited for 1.5 seconds", result.firstText());
        }

        @Test
        void navigate_sendsUrlThenSnapshotsInOrder() throws Exception {
            FakeExtensionClient client = page();

            CallToolResult result = CommonTools.navigate()
                    .execute(client, json("{\"url\":\"https://example.com/\"}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals(List.of("browser_navigate", "getUrl", "getTitle", "browser_snapshot"),
                    client.callTypes());
            assertEquals("https://example.com/", client.calls.get(0).payload().get("url").asText());
            assertNull(client.calls.get(1).payload());
            assertEquals(PAGE_TEXT, result.firstText());
        }

        @Test
        void pressKey_noSnapshot() throws Exception {
            FakeExtensionClient client = new FakeExtensionClient();

            CallToolResult result = CommonTools.pressKey().execute(client, json("{\"key\":\"ArrowLeft\"}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals("Pressed key ArrowLeft", result.firstText());
            assertEquals(List.of("browser_press_key"), client.callTypes());
        }
    }

    @Nested
    class Snapshot {

        @Test
        void click_prependsStatusPart() throws Exception {
            FakeExtensionClient client = page();

            CallToolResult result = SnapshotTools.click()
                    .execute(client, json("{\"element\":\"More information link\",\"ref\":\"s1e7\",\"extra\":1}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals(2, result.getContent().size());
            assertEquals("Clicked \"More information link\"", result.getContent().get(0).getText());
            assertEquals(PAGE_TEXT, result.getContent().get(1).getText());
            JsonNode sent = client.calls.get(0).payload();
            assertEquals("s1e7", sent.get("ref").asText());
            assertFalse(sent.has("extra"));
        }

        @Test
        void drag_namesBothElements() throws Exception {
            CallToolResult result = SnapshotTools.drag().execute(page(), json(
                            "{\"startElement\":\"card\",\"startRef\":\"a\",\"endElement\":\"column\",\"endRef\":\"b\"}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals("Dragged \"card\" to \"column\"", result.firstText());
        }

        @Test
        void type_requiresSubmitFlag() {
            HandlerException e = assertThrows(HandlerException.class, () -> SnapshotTools.type()
                    .execute(page(), json("{\"element\":\"Search\",\"ref\":\"s1e2\",\"text\":\"hi\"}")));
            assertTrue(e.getMessage().contains("\"submit\" is required"));
        }

        @Test
        void selectOption_forwardsValues() throws Exception {
            FakeExtensionClient client = page();

            CallToolResult result = SnapshotTools.selectOption()
                    .execute(client, json("{\"element\":\"Country\",\"ref\":\"s2e1\",\"values\":[\"NL\",\"BE\"]}"))
                    .get(1, TimeUnit.SECONDS);

            assertEquals("Selected option in \"Country\"", result.firstText());
            assertEquals(2, client.calls.get(0).payload().get("values").size());
        }
    }

    @Nested
    class Custom {

        @Test
        void consoleLogs_oneJsonLinePerEntry() throws Exception {
            FakeExtensionClient client = new FakeExtensionClient().respond("browser_get_console_logs",
                    List.of(Map.of("type", "log", "message", "hello"), Map.of("type", "error", "message", "boom")));

            CallToolResult result = CustomTools.getConsoleLogs().execute(client, json("{}"))
                    .get(1, TimeUnit.SECONDS);

            String[] lines = result.firstText().split("\n");
            assertEquals(2, lines.length);
            assertEquals("hello", mapper.readTree(lines[0]).get("message").asText());
            assertEquals("error", mapper.readTree(lines[1]).get("type").asText());
        }

        @Test
        void screenshot_returnsPngImagePart() throws Exception {
            FakeExtensionClient client = new FakeExtensionClient().respond("browser_screenshot", "iVBORw0KGgo=");

            CallToolResult result = CustomTools.screenshot().execute(client, json("{}"))
                    .get(1, TimeUnit.SECONDS);

            Content image = result.getContent().get(0);
            assertEquals("image", image.getType());
            assertEquals("image/png", image.getMimeType());
            assertEquals("iVBORw0KGgo=", image.getData());
            assertNull(image.getText());
        }
    }
}
