package sh.harold.flotilla.cluster.process;

import sh.harold.flotilla.api.process.ProcessProbe;

/**
 * Checks process existence through {@link ProcessHandle}, without signalling the process.
 */
public class ProcessHandleProbe implements ProcessProbe {

    @Override
    public boolean isAlive(long processId) {
        return ProcessHandle.of(processId).map(ProcessHandle::isAlive).orElse(false);
    }
}
