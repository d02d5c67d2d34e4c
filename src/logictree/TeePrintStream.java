package logictree;

import java.io.PrintStream;

/**
 * Console stream that also copies everything written to it into a log file
 * stream. The file side can be swapped when the log rolls over.
 */
public class TeePrintStream extends PrintStream
{
    private volatile PrintStream fileOut;

    public TeePrintStream(PrintStream console, PrintStream fileOut)
    {
        super(console, true);
        this.fileOut = fileOut;
    }

    @Override
    public void write(byte[] buf, int off, int len)
    {
        super.write(buf, off, len);
        fileOut.write(buf, off, len);
    }

    @Override
    public void write(int b)
    {
        super.write(b);
        fileOut.write(b);
    }

    @Override
    public void flush()
    {
        super.flush();
        fileOut.flush();
    }

    /** @return the previous file stream, for the caller to close */
    public PrintStream swapFileOut(PrintStream next)
    {
        PrintStream previous = fileOut;
        fileOut = next;
        return previous;
    }
}
