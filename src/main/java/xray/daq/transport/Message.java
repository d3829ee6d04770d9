package xray.daq.transport;

import xray.daq.processing.ProcessedFrame;

/**
 * Immutable message between ranks.  Only {@link MessageKind#RESULT}
 * messages carry a frame.
 */
public final class Message
{
    private final MessageKind kind;
    private final int source;
    private final ProcessedFrame frame;

    private Message(MessageKind kind, int source, ProcessedFrame frame)
    {
        this.kind = kind;
        this.source = source;
        this.frame = frame;
    }

    public static Message result(int source, ProcessedFrame frame)
    {
        if (frame == null) {
            throw new IllegalArgumentException("RESULT needs a frame");
        }

        return new Message(MessageKind.RESULT, source, frame);
    }

    public static Message end(int source)
    {
        return new Message(MessageKind.END, source, null);
    }

    public static Message terminate(int source)
    {
        return new Message(MessageKind.TERMINATE, source, null);
    }

    public static Message terminated(int source)
    {
        return new Message(MessageKind.TERMINATED, source, null);
    }

    public MessageKind getKind()
    {
        return kind;
    }

    /**
     * @return rank of the sender
     */
    public int getSource()
    {
        return source;
    }

    /**
     * @return frame for RESULT messages, <tt>null</tt> otherwise
     */
    public ProcessedFrame getFrame()
    {
        return frame;
    }

    @Override
    public String toString()
    {
        if (frame == null) {
            return kind + "@" + source;
        }

        return kind + "@" + source + "[" + frame + "]";
    }
}
