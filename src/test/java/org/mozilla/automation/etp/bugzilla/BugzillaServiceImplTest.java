package org.mozilla.automation.etp.bugzilla;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mozilla.automation.etp.HttpErrors.httpError;

import java.util.List;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;

import org.junit.jupiter.api.Test;
import org.mozilla.automation.etp.TransientException;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public class BugzillaServiceImplTest {
    final BugzillaClient client = mock(BugzillaClient.class);

    @Test
    void testSearchBugs() {
        Bug bug = new Bug(1, "summary", "NEW", "", "https://site.example", "[privacy-team:diagnosed]", "", "a@b.c");
        when(client.searchBugs(any())).thenReturn(new BugList(List.of(bug)));
        BugzillaServiceImpl service = new BugzillaServiceImpl(client, false);

        assertThat(service.searchBugs(new BugQuery("Web Compatibility", "Privacy: Site Reports", null)))
                .containsExactly(bug);
    }

    @Test
    void testFetchCreator() {
        when(client.getBug(5, "creator"))
                .thenReturn(new BugList(List.of(new Bug(5, null, null, null, null, null, null, "reporter@example.com"))));
        when(client.getBug(6, "creator")).thenReturn(new BugList(List.of()));
        BugzillaServiceImpl service = new BugzillaServiceImpl(client, false);

        assertThat(service.fetchCreator(5)).contains("reporter@example.com");
        assertThat(service.fetchCreator(6)).isEmpty();
    }

    @Test
    void testUpdatesRequireApiKey() {
        BugzillaServiceImpl service = new BugzillaServiceImpl(client, false);

        assertThat(service.canUpdate()).isFalse();
        assertThatThrownBy(() -> service.closeBug(1, "FIXED", "done"))
                .isInstanceOf(BugzillaException.class)
                .hasMessageContaining("API key");
        verify(client, never()).updateBug(anyLong(), any());
    }

    @Test
    void testCloseAndNeedInfo() {
        when(client.updateBug(anyLong(), any())).thenReturn(JsonNodeFactory.instance.objectNode());
        BugzillaServiceImpl service = new BugzillaServiceImpl(client, true);

        service.closeBug(7, "FIXED", "Deployed");
        service.requestInfo(7, "reporter@example.com", "Verify?");

        verify(client).updateBug(eq(7L), argThat(u -> "RESOLVED".equals(u.status)
                && "FIXED".equals(u.resolution) && "Deployed".equals(u.comment.body())));
        verify(client).updateBug(eq(7L), argThat(u -> u.flags != null
                && u.flags.get(0).requestee().equals("reporter@example.com")));
    }

    @Test
    void testErrorTranslation() {
        WebApplicationException unavailable = httpError(503);
        WebApplicationException unauthorized = httpError(401);
        when(client.getBug(1, "creator")).thenThrow(unavailable);
        when(client.getBug(2, "creator")).thenThrow(unauthorized);
        when(client.getBug(3, "creator")).thenThrow(new ProcessingException("Read timed out"));
        BugzillaServiceImpl service = new BugzillaServiceImpl(client, true);

        assertThatThrownBy(() -> service.fetchCreator(1))
                .isInstanceOfSatisfying(TransientException.class, e -> assertThat(e.status()).isEqualTo(503));
        assertThatThrownBy(() -> service.fetchCreator(2))
                .isInstanceOfSatisfying(BugzillaException.class, e -> assertThat(e.status()).isEqualTo(401));
        assertThatThrownBy(() -> service.fetchCreator(3))
                .isInstanceOf(TransientException.class);
    }
}
