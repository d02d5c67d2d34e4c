package logictree.ws;

import org.java_websocket.WebSocketImpl;
import org.java_websocket.WebSocketListener;
import org.java_websocket.drafts.Draft;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** One client connection with its own options and message counter. */
public class LogicTreeWebSocketImpl extends WebSocketImpl
{
    private final AtomicLong messageID = new AtomicLong(-1);
    private volatile boolean messageIDs = false;
    private volatile boolean render = false;
    private String IP = null;

    public LogicTreeWebSocketImpl(WebSocketListener listener, Draft draft)
    {
        super(listener, draft);
    }

    public LogicTreeWebSocketImpl(WebSocketListener listener, List<Draft> drafts)
    {
        super(listener, drafts == null || drafts.isEmpty() ? Collections.singletonList(LogicTreeWebSocket.newDraft()) : drafts);
    }

    public void setIP(String IP)
    {
        if (this.IP == null)
            this.IP = IP;
    }

    public String getIP()
    {
        return IP;
    }

    public boolean optMessageIDs()
    {
        return messageIDs;
    }

    public boolean optRender()
    {
        return render;
    }

    /** Fills in the {@code "%nextid%"} placeholder before the frame goes out. */
    @Override
    public void send(String text)
    {
        if (messageIDs)
            text = text.replace("\"%nextid%\"", Long.toString(messageID.incrementAndGet()));
        else
            text = text.replace("\"%nextid%\"", "-1");

        transmit(text);
    }

    protected void transmit(String text)
    {
        super.send(text);
    }

    public void receive(String message)
    {
        JSONObject reply;
        try
        {
            JSONObject msg = new JSONObject(message).getJSONObject("Message");

            if (ParseRequests.SET_OPTIONS.equals(msg.optString("type")))
                setOptions(msg.optJSONArray("options"));

            reply = ParseRequests.handle(msg, render);
        }
        catch (JSONException e)
        {
            LogicTreeWebSocket.printWebSocket(String.format("Unrecognised message from %s \"%s\": %s", IP, message, e.getMessage()), true);
            reply = ParseRequests.error("REQUEST", e.getMessage());
        }

        if (reply == null)
            return;

        try
        {
            send(ParseRequests.wrap(reply));
        }
        catch (WebsocketNotConnectedException e)
        {
            LogicTreeWebSocket.printWebSocket("Client " + IP + " went away before its reply (" + getReadyState() + ")", true);
        }
    }

    private void setOptions(JSONArray options)
    {
        boolean messageIDsNew = false;
        boolean renderNew = false;

        if (options != null)
        {
            for (Object o : options)
            {
                String opt = String.valueOf(o);
                if ("message_ids".equals(opt))
                    messageIDsNew = true;
                else if ("render".equals(opt))
                    renderNew = true;
            }
        }

        messageIDs = messageIDsNew;
        render = renderNew;
    }

    @Override
    public String toString()
    {
        return LogicTreeWebSocketImpl.class.getName() + ":" + getRemoteSocketAddress();
    }
}
