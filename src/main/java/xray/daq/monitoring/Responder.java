package xray.daq.monitoring;

import java.util.Map;

/**
 * Answers requests from external programs.
 */
public interface Responder
{
    /**
     * Fetch the next request without waiting.
     *
     * @return <tt>null</tt> if no request is waiting
     */
    ExternalRequest poll();

    /**
     * Send the reply to a request.
     *
     * @return <tt>false</tt> if the reply could not be sent
     */
    boolean reply(ExternalRequest request, Map<String, Object> data);

    void close();
}
