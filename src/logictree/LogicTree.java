package logictree;

import logictree.output.TokenTable;
import logictree.output.TreeRenderer;
import logictree.parsing.ExpressionException;
import logictree.parsing.Lexer;
import logictree.parsing.Node;
import logictree.parsing.Parser;
import logictree.parsing.Token;
import logictree.ws.LogicTreeWebSocket;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

public class LogicTree
{
    public static final String VERSION = "1";

    public static final AtomicBoolean STOP = new AtomicBoolean(false);

    public static File STORAGE_DIR = new File(System.getProperty("user.home", System.getProperty("user.dir", ".")), ".logictree");
    public static JSONObject config = new JSONObject();

    public static final SimpleDateFormat sdfDate     = new SimpleDateFormat("dd/MM/yy");
    public static final SimpleDateFormat sdfDateTime = new SimpleDateFormat("dd/MM/yy HH:mm:ss");

    private static PrintStream logStream;
    private static File        logFile;
    private static String      lastLogDate = "";

    public static LogicTreeWebSocket webSocket;

    private static final PrintStream stdOut = System.out;
    private static final PrintStream stdErr = System.err;

    public static void main(String[] args)
    {
        String inputName = null;
        boolean json = false;
        boolean serve = false;

        for (int i = 0; i < args.length; i++)
        {
            if ("--storage".equals(args[i]) && i + 1 < args.length)
                STORAGE_DIR = new File(args[++i]);
            else if ("--json".equals(args[i]))
                json = true;
            else if ("--serve".equals(args[i]))
                serve = true;
            else if (args[i].startsWith("--"))
            {
                stdErr.println("Unknown option " + args[i]);
                stdErr.println("Usage: LogicTree [--storage <dir>] [--json] [--serve] [input-file]");
                System.exit(2);
            }
            else
                inputName = args[i];
        }

        System.setProperty("org.slf4j.simpleLogger.showDateTime", "true");
        System.setProperty("org.slf4j.simpleLogger.dateTimeFormat", "[dd/MM/yy HH:mm:ss]");

        reloadConfig();

        if (config.optBoolean("log_to_file", true))
            openLogFile();

        printOut("[Startup] Starting... (v" + VERSION + ")");

        Thread.setDefaultUncaughtExceptionHandler((t, e) -> printThrowable(e, t.getName()));

        if (serve)
        {
            startServer();
            return;
        }

        if (inputName == null)
            inputName = config.optString("input_file", "input.txt");
        if (!json)
            json = "json".equalsIgnoreCase(config.optString("output", "text"));

        int status = run(new File(inputName), json, System.out, System.err);

        if (logStream != null)
            logStream.flush();
        System.exit(status);
    }

    /**
     * Reads, tokenizes and parses one input file, writing the token table and
     * the tree (or their JSON form) to {@code out}.
     *
     * @return process exit status, 0 on success
     */
    public static int run(File input, boolean json, PrintStream out, PrintStream err)
    {
        String text;
        try
        {
            text = readSource(input.toPath());
        }
        catch (NoSuchFileException | FileNotFoundException e)
        {
            err.println("File '" + input.getPath() + "' not found.");
            printOut("[Input] Missing input " + input.getAbsolutePath());
            return 1;
        }
        catch (IOException e)
        {
            err.println("Cannot read '" + input.getPath() + "': " + e.getMessage());
            printThrowable(e, "Input");
            return 1;
        }

        List<Token> tokens;
        Node tree;
        boolean trailing;
        try
        {
            tokens = Lexer.tokenize(text);
            printOut("[Lexer] " + tokens.size() + " tokens from " + input.getName());

            if (!json)
                out.print(TokenTable.render(tokens) + "\n");

            Parser parser = new Parser(tokens);
            tree = parser.parse();
            trailing = parser.hasRemaining();
        }
        catch (ExpressionException e)
        {
            err.println("Error: " + e.getMessage());
            printOut("[" + e.getCategory() + "] " + e.getMessage());
            return 1;
        }

        if (trailing)
            printErr("[Parser] Input continues after the statement's ';', remaining tokens ignored");

        if (json)
        {
            JSONObject result = new JSONObject();
            result.put("tokens", TokenTable.toJSON(tokens));
            result.put("tree", tree.toJSON());
            out.println(result.toString(2));
        }
        else
        {
            out.println("Parse tree:");
            out.println(TokenTable.RULE);
            out.print(TreeRenderer.render(tree));
        }
        out.flush();

        return 0;
    }

    public static String readSource(Path path) throws IOException
    {
        String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return text.replace("\r\n", "\n");
    }

    //<editor-fold defaultstate="collapsed" desc="Server">
    private static void startServer()
    {
        ensureServerOpen();

        Runtime.getRuntime().addShutdownHook(new Thread(() ->
        {
            printOut("[Main] Stopping...", true);
            STOP.set(true);

            if (webSocket != null)
            {
                try { webSocket.stop(1000); }
                catch (InterruptedException e) { Thread.currentThread().interrupt(); }
            }

            printOut("[Main] Stopped", true);
        }, "LogicTreeShutdown"));

        Thread configWatcher = new Thread(LogicTree::watchConfig, "ConfigWatcher");
        configWatcher.setDaemon(true);
        configWatcher.start();
    }

    private static void watchConfig()
    {
        if (!STORAGE_DIR.isDirectory())
        {
            printErr("[Config] Storage directory " + STORAGE_DIR + " does not exist, config will not be watched");
            return;
        }

        final Path configPath = new File(STORAGE_DIR, "config.json").toPath();
        printOut("[Config] Watching " + configPath, true);

        try (final WatchService watchService = FileSystems.getDefault().newWatchService())
        {
            STORAGE_DIR.toPath().register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

            while (!STOP.get())
            {
                final WatchKey wk = watchService.take();
                for (WatchEvent<?> event : wk.pollEvents())
                {
                    if (event.context() instanceof Path && configPath.endsWith((Path) event.context()))
                    {
                        printOut("[Config] Reloading config", true);
                        reloadConfig();
                    }
                }
                wk.reset();
            }
        }
        catch (IOException e) { printThrowable(e, "ConfigWatcher"); }
        catch (InterruptedException e) { Thread.currentThread().interrupt(); }
    }

    public static synchronized void ensureServerOpen()
    {
        if (webSocket == null || webSocket.isClosed())
        {
            final LogicTreeWebSocket server = new LogicTreeWebSocket(config.optInt("WSPort", 8443));
            webSocket = server;

            new Thread(() -> {
                try
                {
                    server.run();
                }
                catch (Exception e)
                {
                    printThrowable(e, "WebSocket");
                }
                finally
                {
                    LogicTreeWebSocket.printWebSocket("WebSocket server runnable finished" + (server.isClosed() ? "" : " unexpectedly"), !server.isClosed(), true);
                }
            }, "WebSocket").start();
        }
    }
    //</editor-fold>

    public static void reloadConfig()
    {
        File configFile = new File(STORAGE_DIR, "config.json");
        if (!configFile.isFile())
        {
            printOut("[Config] No config.json in " + STORAGE_DIR + ", using defaults");
            return;
        }

        try (BufferedReader br = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8))
        {
            JSONObject oldConfig = config;
            config = new JSONObject(new JSONTokener(br));

            if (webSocket != null && oldConfig.optInt("WSPort", 8443) != config.optInt("WSPort", 8443))
            {
                printOut("[WebSocket] Restarting WS Server on " + config.optInt("WSPort", 8443), true);

                try { webSocket.stop(0); }
                catch (InterruptedException e) { Thread.currentThread().interrupt(); }

                ensureServerOpen();
            }
        }
        catch (IOException | JSONException ex)
        {
            printThrowable(ex, "Config");
        }
    }

    //<editor-fold defaultstate="collapsed" desc="Print methods">
    private static synchronized void openLogFile()
    {
        lastLogDate = sdfDate.format(new Date());
        logFile = new File(STORAGE_DIR, "Logs" + File.separator + "LogicTree" + File.separator + lastLogDate.replace("/", "-") + ".log");
        logFile.getParentFile().mkdirs();

        try
        {
            logStream = new PrintStream(new FileOutputStream(logFile, true), true, "UTF-8");
            System.setOut(new TeePrintStream(stdOut, logStream));
            System.setErr(new TeePrintStream(stdErr, logStream));
        }
        catch (IOException e)
        {
            logStream = null;
            printErr("[Logging] Could not create log file " + logFile);
        }
    }

    public static void printThrowable(Throwable t, String name)
    {
        name = name == null ? "" : name;

        StackTraceElement caller = Thread.currentThread().getStackTrace()[2];
        name += (name.isEmpty() ? "" : " ");
        name += caller.getFileName() != null && caller.getLineNumber() >= 0 ?
                "(" + caller.getFileName() + ":" + caller.getLineNumber() + ")" :
                (caller.getFileName() != null ? "(" + caller.getFileName() + ")" : "(Unknown Source)");

        printErr("[" + name + "] " + t);

        for (StackTraceElement element : t.getStackTrace())
            printErr("[" + name + "] -> " + element);

        for (Throwable sup : t.getSuppressed())
            printCause(sup, name);

        printCause(t.getCause(), name);
    }

    private static void printCause(Throwable t, String name)
    {
        if (t != null)
        {
            printErr("[" + name + "] caused by " + t);

            for (StackTraceElement element : t.getStackTrace())
                printErr("[" + name + "] -> " + element);
        }
    }

    public static void printOut(String message)
    {
        printOut(message, false);
    }

    public static void printOut(String message, boolean forceStdout)
    {
        if (message == null || message.isEmpty())
            return;

        for (String msgPart : message.split("\n"))
            print("[" + timestamp() + "] " + msgPart, false, forceStdout);
    }

    public static void printErr(String message)
    {
        if (message == null || message.isEmpty())
            return;

        for (String msgPart : message.split("\n"))
            print("[" + timestamp() + "] !!!> " + msgPart + " <!!!", true, true);
    }

    private static String timestamp()
    {
        synchronized (sdfDateTime)
        {
            return sdfDateTime.format(new Date());
        }
    }

    private static synchronized void print(String message, boolean toErr, boolean forceStdout)
    {
        if (toErr)
            stdErr.println(message);
        else if (forceStdout)
            stdOut.println(message);

        filePrint(message);
    }

    private static synchronized void filePrint(String message)
    {
        if (logStream == null)
            return;

        String today = sdfDate.format(new Date());
        if (!lastLogDate.equals(today))
        {
            lastLogDate = today;
            logFile = new File(STORAGE_DIR, "Logs" + File.separator + "LogicTree" + File.separator + today.replace("/", "-") + ".log");
            logFile.getParentFile().mkdirs();

            try
            {
                logStream = new PrintStream(new FileOutputStream(logFile, true), true, "UTF-8");

                if (System.out instanceof TeePrintStream)
                    ((TeePrintStream) System.out).swapFileOut(logStream).close();
                if (System.err instanceof TeePrintStream)
                    ((TeePrintStream) System.err).swapFileOut(logStream);
            }
            catch (IOException e)
            {
                stdErr.println("[" + timestamp() + "] !!!> [Logging] Could not roll log file to " + logFile + " <!!!");
            }
        }

        logStream.println(message);
    }
    //</editor-fold>
}
