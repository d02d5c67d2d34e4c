package logictree.ws;

import logictree.LogicTree;
import org.java_websocket.WebSocket;
import org.java_websocket.WebSocketAdapter;
import org.java_websocket.WebSocketImpl;
import org.java_websocket.drafts.Draft;
import org.java_websocket.drafts.Draft_6455;
import org.java_websocket.extensions.permessage_deflate.PerMessageDeflateExtension;
import org.java_websocket.framing.CloseFrame;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.DefaultWebSocketServerFactory;
import org.java_websocket.server.WebSocketServer;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Parse service: clients send source text and get tokens and tree back as JSON.
 * Plain {@code ws://}; terminate TLS in front of it if needed.
 */
public class LogicTreeWebSocket extends WebSocketServer
{
    private final AtomicBoolean serverClosed = new AtomicBoolean(false);

    public LogicTreeWebSocket(int port)
    {
        super(new InetSocketAddress(port),
                4, // Number of worker threads
                Collections.singletonList(newDraft()));
        setReuseAddr(true);

        setWebSocketFactory(new DefaultWebSocketServerFactory()
        {
            @Override
            public WebSocketImpl createWebSocket(WebSocketAdapter a, Draft d)
            {
                return new LogicTreeWebSocketImpl(a, d);
            }

            @Override
            public WebSocketImpl createWebSocket(WebSocketAdapter a, List<Draft> d)
            {
                return new LogicTreeWebSocketImpl(a, d);
            }
        });
    }

    static Draft newDraft()
    {
        return new Draft_6455(new PerMessageDeflateExtension());
    }

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake)
    {
        if (!(conn instanceof LogicTreeWebSocketImpl))
            return;

        LogicTreeWebSocketImpl ltconn = (LogicTreeWebSocketImpl) conn;
        ltconn.setIP(handshake.hasFieldValue("X-Forwarded-For") ? handshake.getFieldValue("X-Forwarded-For") :
                conn.getRemoteSocketAddress().getAddress().getHostAddress());

        printWebSocket(String.format("Open connection to %s%s",
                ltconn.getIP(),
                handshake.hasFieldValue("User-Agent") ? " (" + handshake.getFieldValue("User-Agent") + ")" : ""), false);

        JSONObject content = ParseRequests.newContent("HELLO");
        content.put("options", new JSONArray(Arrays.asList("message_ids", "render")));
        ltconn.send(ParseRequests.wrap(content));
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote)
    {
        printWebSocket(String.format("Close connection %s %s (%s%s)",
                remote ? "from" : "to",
                describe(conn),
                code,
                reason != null && !reason.isEmpty() ? "/" + reason : ""), false);
    }

    @Override
    public void onMessage(WebSocket conn, String message)
    {
        if (conn instanceof LogicTreeWebSocketImpl)
            ((LogicTreeWebSocketImpl) conn).receive(message);
        else
            printWebSocket("Message from unknown connection type " + conn.getClass().getName() + " dropped", true);
    }

    @Override
    public void onError(WebSocket conn, Exception ex)
    {
        if (conn == null)
        {
            LogicTree.printThrowable(ex, "WebSocket");
            return;
        }

        printWebSocket("Error (" + describe(conn) + "): " + ex, true);
        conn.close(CloseFrame.NORMAL, ex.getMessage());
    }

    @Override
    public void onStart()
    {
        printWebSocket("Started on " + getPort(), false, true);
    }

    @Override
    public void stop(int timeout) throws InterruptedException
    {
        serverClosed.set(true);
        super.stop(timeout);
    }

    public boolean isClosed()
    {
        return serverClosed.get();
    }

    private static String describe(WebSocket conn)
    {
        if (conn instanceof LogicTreeWebSocketImpl && ((LogicTreeWebSocketImpl) conn).getIP() != null)
            return ((LogicTreeWebSocketImpl) conn).getIP();
        return String.valueOf(conn.getRemoteSocketAddress());
    }

    public static void printWebSocket(String message, boolean toErr)
    {
        printWebSocket(message, toErr, false);
    }

    public static void printWebSocket(String message, boolean toErr, boolean forceStdout)
    {
        if (toErr)
            LogicTree.printErr("[WebSocket] " + message);
        else
            LogicTree.printOut("[WebSocket] " + message, forceStdout);
    }
}
