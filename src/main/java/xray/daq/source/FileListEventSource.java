package xray.daq.source;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

/**
 * Events read from a list of raw frame files.  Each file is one event;
 * its modification time is the event timestamp.  Beam energy and detector
 * distance come from configured fallback values.
 */
public class FileListEventSource
    implements EventSource
{
    private static final Logger LOG =
        Logger.getLogger(FileListEventSource.class);

    private final List<File> files;
    private final int pixelsPerFrame;
    private final double beamEnergy;
    private final double detectorDistance;

    /**
     * @param files ordered list of event files
     * @param pixelsPerFrame slab size
     * @param beamEnergy fallback photon energy in eV (NaN if unknown)
     * @param detectorDistance fallback distance in metres (NaN if unknown)
     */
    public FileListEventSource(List<File> files, int pixelsPerFrame,
                               double beamEnergy, double detectorDistance)
    {
        this.files = Collections.unmodifiableList(new ArrayList<File>(files));
        this.pixelsPerFrame = pixelsPerFrame;
        this.beamEnergy = beamEnergy;
        this.detectorDistance = detectorDistance;
    }

    /**
     * Read a list file holding one path per line.  Blank lines and lines
     * starting with '#' are ignored; relative paths are resolved against
     * the list file's directory.
     */
    public static List<File> readFileList(File listFile)
        throws SourceAccessException
    {
        final File dir = listFile.getAbsoluteFile().getParentFile();

        ArrayList<File> list = new ArrayList<File>();

        BufferedReader rdr = null;
        try {
            rdr = new BufferedReader(new FileReader(listFile));
            for (String line = rdr.readLine(); line != null;
                 line = rdr.readLine())
            {
                line = line.trim();
                if (line.length() == 0 || line.startsWith("#")) {
                    continue;
                }

                File f = new File(line);
                if (!f.isAbsolute()) {
                    f = new File(dir, line);
                }
                list.add(f);
            }
        } catch (IOException ioe) {
            throw new SourceAccessException("Cannot read file list " +
                                            listFile, ioe);
        } finally {
            if (rdr != null) {
                try {
                    rdr.close();
                } catch (IOException ioe) {
                    LOG.error("Cannot close " + listFile, ioe);
                }
            }
        }

        return list;
    }

    public List<File> getFiles()
    {
        return files;
    }

    @Override
    public EventIterator open(int rank, int poolSize)
    {
        List<File> slice = WorkPartition.slice(files, rank, poolSize);
        if (LOG.isInfoEnabled()) {
            LOG.info("Rank " + rank + " reads " + slice.size() + " of " +
                     files.size() + " files");
        }

        return new FileIterator(slice);
    }

    class FileIterator
        implements EventIterator
    {
        private final List<File> slice;
        private int next;

        FileIterator(List<File> slice)
        {
            this.slice = slice;
        }

        @Override
        public boolean hasNext()
        {
            return next < slice.size();
        }

        @Override
        public RawEvent next()
            throws SourceAccessException
        {
            if (!hasNext()) {
                throw new NoSuchElementException("No more files");
            }

            final File file = slice.get(next++);

            RawFrameFile rff;
            try {
                rff = new RawFrameFile(file, pixelsPerFrame);
            } catch (IOException ioe) {
                throw new SourceAccessException("Cannot open " + file, ioe);
            }

            return new FileEvent(rff, file.lastModified() / 1000.0);
        }

        @Override
        public void close()
        {
            next = slice.size();
        }
    }

    class FileEvent
        implements RawEvent
    {
        private final RawFrameFile rff;
        private final double timestamp;

        FileEvent(RawFrameFile rff, double timestamp)
        {
            this.rff = rff;
            this.timestamp = timestamp;
        }

        @Override
        public String getEventId()
        {
            return rff.getFile().getPath();
        }

        @Override
        public double getTimestamp()
        {
            return timestamp;
        }

        @Override
        public int getNumFrames()
        {
            return rff.getNumFrames();
        }

        @Override
        public float[] extractFrame(int index)
            throws FrameExtractionException
        {
            try {
                return rff.readFrame(index);
            } catch (IOException ioe) {
                throw new FrameExtractionException("Cannot read frame " +
                                                   index + " from " +
                                                   rff.getFile(), ioe);
            }
        }

        @Override
        public double getBeamEnergy()
        {
            return beamEnergy;
        }

        @Override
        public double getDetectorDistance()
        {
            return detectorDistance;
        }

        @Override
        public void close()
        {
            try {
                rff.close();
            } catch (IOException ioe) {
                LOG.error("Cannot close " + rff.getFile(), ioe);
            }
        }
    }
}
