package logictree.ws;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LogicTreeWebSocketImplTest
{
    /** Keeps outgoing frames instead of writing them to a socket. */
    private static class RecordingConnection extends LogicTreeWebSocketImpl
    {
        private final List<String> sent = new ArrayList<>();

        RecordingConnection()
        {
            super(new LogicTreeWebSocket(0), LogicTreeWebSocket.newDraft());
        }

        @Override
        protected void transmit(String text)
        {
            sent.add(text);
        }

        JSONObject reply(int index)
        {
            return new JSONObject(sent.get(index)).getJSONObject("Message");
        }
    }

    private RecordingConnection conn;

    @BeforeEach
    void setUp()
    {
        conn = new RecordingConnection();
    }

    private static String parse(String text)
    {
        JSONObject msg = new JSONObject().put("type", "PARSE").put("text", text);
        return new JSONObject().put("Message", msg).toString();
    }

    private static String options(String... opts)
    {
        JSONObject msg = new JSONObject().put("type", "SET_OPTIONS").put("options", new JSONArray(Arrays.asList(opts)));
        return new JSONObject().put("Message", msg).toString();
    }

    @Test
    void repliesCarryMinusOneWithoutMessageIds()
    {
        conn.receive(parse("x := a;"));
        conn.receive(parse("y := b;"));

        assertEquals(2, conn.sent.size());
        assertEquals(-1, conn.reply(0).getInt("messageID"));
        assertEquals(-1, conn.reply(1).getInt("messageID"));
        assertFalse(conn.sent.get(0).contains("%nextid%"));
    }

    @Test
    void messageIdsIncreasePerConnection()
    {
        conn.receive(options("message_ids"));
        conn.receive(parse("x := a;"));
        conn.receive(parse("x := ;"));
        conn.receive(parse("x := b;"));

        assertTrue(conn.optMessageIDs());
        assertEquals(3, conn.sent.size());
        assertEquals(0, conn.reply(0).getInt("messageID"));
        assertEquals(1, conn.reply(1).getInt("messageID"));
        assertEquals("ERROR", conn.reply(1).getString("type"));
        assertEquals(2, conn.reply(2).getInt("messageID"));
    }

    @Test
    void renderOptionAddsTextTreeToLaterReplies()
    {
        conn.receive(parse("x := a;"));
        assertFalse(conn.reply(0).has("rendered"));

        conn.receive(options("render"));
        assertTrue(conn.optRender());
        conn.receive(parse("x := a;"));

        assertEquals(2, conn.sent.size());
        assertTrue(conn.reply(1).getString("rendered").startsWith("└── S\n"));
    }

    @Test
    void setOptionsReplacesEarlierOptions()
    {
        conn.receive(options("message_ids", "render"));
        conn.receive(options());

        assertFalse(conn.optMessageIDs());
        assertFalse(conn.optRender());
        assertTrue(conn.sent.isEmpty());
    }

    @Test
    void malformedJsonGetsRequestError()
    {
        conn.receive("{not json");
        conn.receive("{\"type\": \"PARSE\"}");

        assertEquals(2, conn.sent.size());
        assertEquals("ERROR", conn.reply(0).getString("type"));
        assertEquals("REQUEST", conn.reply(0).getString("error"));
        assertEquals("REQUEST", conn.reply(1).getString("error"));
    }

    @Test
    void ipIsSetOnlyOnce()
    {
        conn.setIP("10.0.0.1");
        conn.setIP("10.0.0.2");
        assertEquals("10.0.0.1", conn.getIP());
    }
}
