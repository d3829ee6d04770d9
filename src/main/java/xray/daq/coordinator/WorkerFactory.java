package xray.daq.coordinator;

import xray.daq.source.SourceAccessException;
import xray.daq.transport.Transport;

/**
 * Builds the worker for one rank.
 */
public interface WorkerFactory
{
    /**
     * @param transport the worker's messaging endpoint
     *
     * @return new worker
     *
     * @throws SourceAccessException if the worker's data cannot be opened
     */
    WorkerNode create(Transport transport)
        throws SourceAccessException;
}
