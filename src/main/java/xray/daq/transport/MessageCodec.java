package xray.daq.transport;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import xray.daq.processing.PeakList;
import xray.daq.processing.ProcessedFrame;

/**
 * Binary encoding of {@link Message}s for stream transports.
 *
 * Each record is a 4-byte body length followed by the body:
 * <pre>
 *    byte  kind
 *    int   source rank
 *    ...   frame (RESULT only)
 * </pre>
 * A frame is encoded as:
 * <pre>
 *    short  event ID length, followed by the UTF-8 event ID
 *    int    frame index
 *    double timestamp
 *    byte   flags (hit, saturated, has image)
 *    double beam energy
 *    double detector distance
 *    int    number of peaks, followed by fs, ss, intensity per peak
 *    int    image width, int image height, floats (image flag only)
 * </pre>
 * All values are big-endian.
 */
public final class MessageCodec
{
    /** Bytes in the length prefix */
    public static final int LENGTH_BYTES = 4;
    /** Largest acceptable body */
    public static final int MAX_BODY_BYTES = 256 * 1024 * 1024;

    private static final int HEADER_BYTES = 5;

    private static final int FLAG_HIT = 0x1;
    private static final int FLAG_SATURATED = 0x2;
    private static final int FLAG_IMAGE = 0x4;

    private MessageCodec()
    {
    }

    /**
     * Encode a message, including its length prefix.
     *
     * @return buffer positioned at the start of the record
     */
    public static ByteBuffer encode(Message msg)
    {
        ProcessedFrame frame = msg.getFrame();

        byte[] idBytes = null;
        int bodyLen = HEADER_BYTES;
        if (frame != null) {
            idBytes = frame.getEventId().getBytes(StandardCharsets.UTF_8);
            if (idBytes.length > Short.MAX_VALUE) {
                throw new IllegalArgumentException("Event ID is too long (" +
                                                   idBytes.length +
                                                   " bytes)");
            }

            bodyLen += 2 + idBytes.length + 4 + 8 + 1 + 8 + 8 + 4 +
                frame.getPeaks().size() * 24;
            if (frame.hasImage()) {
                bodyLen += 8 + frame.getImage().length * 4;
            }
        }

        ByteBuffer buf = ByteBuffer.allocate(LENGTH_BYTES + bodyLen);
        buf.putInt(bodyLen);
        buf.put(msg.getKind().getCode());
        buf.putInt(msg.getSource());

        if (frame != null) {
            buf.putShort((short) idBytes.length);
            buf.put(idBytes);
            buf.putInt(frame.getFrameIndex());
            buf.putDouble(frame.getTimestamp());

            int flags = 0;
            if (frame.isHit()) {
                flags |= FLAG_HIT;
            }
            if (frame.isSaturated()) {
                flags |= FLAG_SATURATED;
            }
            if (frame.hasImage()) {
                flags |= FLAG_IMAGE;
            }
            buf.put((byte) flags);

            buf.putDouble(frame.getBeamEnergy());
            buf.putDouble(frame.getDetectorDistance());

            PeakList peaks = frame.getPeaks();
            buf.putInt(peaks.size());
            for (int i = 0; i < peaks.size(); i++) {
                buf.putDouble(peaks.getFs(i));
                buf.putDouble(peaks.getSs(i));
                buf.putDouble(peaks.getIntensity(i));
            }

            if (frame.hasImage()) {
                buf.putInt(frame.getImageWidth());
                buf.putInt(frame.getImageHeight());
                buf.asFloatBuffer().put(frame.getImage());
                buf.position(buf.position() + frame.getImage().length * 4);
            }
        }

        buf.flip();
        return buf;
    }

    /**
     * Decode one message body (the bytes following the length prefix).
     *
     * @throws TransportException if the body is malformed
     */
    public static Message decode(ByteBuffer body)
        throws TransportException
    {
        try {
            final byte code = body.get();
            final int source = body.getInt();

            MessageKind kind = MessageKind.fromCode(code);
            if (kind == null) {
                throw new TransportException("Unknown message kind " + code +
                                             " from rank " + source);
            }

            Message msg;
            switch (kind) {
            case RESULT:
                msg = Message.result(source, decodeFrame(body));
                break;
            case END:
                msg = Message.end(source);
                break;
            case TERMINATE:
                msg = Message.terminate(source);
                break;
            case TERMINATED:
                msg = Message.terminated(source);
                break;
            default:
                throw new Error("Unhandled message kind " + kind);
            }

            if (body.hasRemaining()) {
                throw new TransportException(body.remaining() +
                                             " extra bytes after " + msg);
            }

            return msg;
        } catch (BufferUnderflowException bue) {
            throw new TransportException("Truncated message", bue);
        }
    }

    private static ProcessedFrame decodeFrame(ByteBuffer body)
        throws TransportException
    {
        final int idLen = body.getShort();
        if (idLen < 0) {
            throw new TransportException("Bad event ID length " + idLen);
        }
        byte[] idBytes = new byte[idLen];
        body.get(idBytes);

        final int frameIndex = body.getInt();
        final double timestamp = body.getDouble();
        final int flags = body.get();
        final double beamEnergy = body.getDouble();
        final double distance = body.getDouble();

        final int numPeaks = body.getInt();
        if (numPeaks < 0 || numPeaks > body.remaining() / 24) {
            throw new TransportException("Bad peak count " + numPeaks);
        }
        double[] fs = new double[numPeaks];
        double[] ss = new double[numPeaks];
        double[] intensity = new double[numPeaks];
        for (int i = 0; i < numPeaks; i++) {
            fs[i] = body.getDouble();
            ss[i] = body.getDouble();
            intensity[i] = body.getDouble();
        }

        ProcessedFrame.Builder bldr =
            new ProcessedFrame.Builder(new String(idBytes,
                                                  StandardCharsets.UTF_8),
                                       frameIndex)
            .timestamp(timestamp)
            .hit((flags & FLAG_HIT) != 0)
            .saturated((flags & FLAG_SATURATED) != 0)
            .beamEnergy(beamEnergy)
            .detectorDistance(distance)
            .peaks(new PeakList(fs, ss, intensity));

        if ((flags & FLAG_IMAGE) != 0) {
            final int width = body.getInt();
            final int height = body.getInt();
            if (width < 0 || height < 0 ||
                (long) width * height * 4 > body.remaining())
            {
                throw new TransportException("Bad image size " + width + "x" +
                                             height);
            }

            float[] image = new float[width * height];
            body.asFloatBuffer().get(image);
            body.position(body.position() + image.length * 4);
            bldr.image(image, width, height);
        }

        return bldr.build();
    }
}
