package xray.daq.transport;

/**
 * Every kind of message exchanged between ranks.
 */
public enum MessageKind
{
    /** worker to collector: one processed frame */
    RESULT(1),
    /** worker to collector: the worker has nothing more to send */
    END(2),
    /** collector to worker: stop fetching events */
    TERMINATE(3),
    /** worker to collector: acknowledgement of TERMINATE */
    TERMINATED(4);

    private final byte code;

    MessageKind(int code)
    {
        this.code = (byte) code;
    }

    public byte getCode()
    {
        return code;
    }

    /**
     * Find the kind with the specified wire code.
     *
     * @return matching kind, or <tt>null</tt> if the code is unknown
     */
    public static MessageKind fromCode(byte code)
    {
        for (MessageKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }

        return null;
    }
}
