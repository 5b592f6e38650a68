package org.mozilla.automation.etp.bugzilla;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.mozilla.automation.etp.TransientException;

import io.quarkus.logging.Log;

/**
 * Bugzilla REST implementation of {@link BugzillaService}.
 * Instantiated by {@link BugzillaServiceProducer}.
 */
class BugzillaServiceImpl implements BugzillaService {
    static final String ME = "🐞-bugzilla";

    private final BugzillaClient client;
    private final boolean hasApiKey;

    BugzillaServiceImpl(BugzillaClient client, boolean hasApiKey) {
        this.client = client;
        this.hasApiKey = hasApiKey;
    }

    @Override
    public boolean canUpdate() {
        return hasApiKey;
    }

    @Override
    public List<Bug> searchBugs(BugQuery query) {
        BugList result = invoke("search bugs in %s :: %s".formatted(query.product(), query.component()),
                () -> client.searchBugs(new BugSearchRequest(query)));
        Log.debugf("[%s] %d bug(s) found for %s", ME, result.bugs().size(), query);
        return result.bugs();
    }

    @Override
    public Optional<String> fetchCreator(long bugId) {
        BugList result = invoke("fetch creator of bug " + bugId,
                () -> client.getBug(bugId, "creator"));
        return result.bugs().stream()
                .map(Bug::creator)
                .filter(c -> c != null && !c.isBlank())
                .findFirst();
    }

    @Override
    public void closeBug(long bugId, String resolution, String comment) {
        requireApiKey("close bug " + bugId);
        invoke("close bug " + bugId,
                () -> client.updateBug(bugId, BugUpdate.close(resolution, comment)));
        Log.infof("[%s] Bug %d closed as %s", ME, bugId, resolution);
    }

    @Override
    public void requestInfo(long bugId, String requestee, String message) {
        requireApiKey("needinfo on bug " + bugId);
        invoke("needinfo %s on bug %d".formatted(requestee, bugId),
                () -> client.updateBug(bugId, BugUpdate.needInfo(requestee, message)));
        Log.infof("[%s] NeedInfo %s for bug %d", ME, requestee, bugId);
    }

    private void requireApiKey(String action) {
        if (!hasApiKey) {
            throw new BugzillaException("Bugzilla API key is not configured; unable to " + action);
        }
    }

    private <T> T invoke(String action, Supplier<T> call) {
        try {
            T result = call.get();
            if (result == null) {
                throw new BugzillaException("Empty response from Bugzilla: " + action);
            }
            return result;
        } catch (WebApplicationException e) {
            int status = e.getResponse() == null ? -1 : e.getResponse().getStatus();
            if (TransientException.isTransientStatus(status)) {
                throw new TransientException("Unable to " + action, status, e);
            }
            throw new BugzillaException("Unable to " + action, status, e);
        } catch (ProcessingException e) {
            throw new TransientException("Unable to " + action, e);
        }
    }
}
