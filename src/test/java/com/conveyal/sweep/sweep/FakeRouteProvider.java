package com.conveyal.sweep.sweep;

import com.conveyal.sweep.api.Location;
import com.conveyal.sweep.api.ProbeOutcome;
import com.conveyal.sweep.api.ProviderName;
import com.conveyal.sweep.api.SearchMode;
import com.conveyal.sweep.provider.RouteProvider;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * RouteProvider answering from a function of the requested instant and mode, recording every call it receives.
 */
class FakeRouteProvider implements RouteProvider {

    interface Responder {
        ProbeOutcome respond (Instant instant, SearchMode mode) throws IOException;
    }

    /** One recorded call. */
    static class Call {
        final Instant instant;
        final SearchMode mode;

        Call (Instant instant, SearchMode mode) {
            this.instant = instant;
            this.mode = mode;
        }
    }

    private final ProviderName name;

    private final Responder responder;

    private final boolean enabled;

    final List<Call> calls = new CopyOnWriteArrayList<>();

    FakeRouteProvider (ProviderName name, boolean enabled, Responder responder) {
        this.name = name;
        this.enabled = enabled;
        this.responder = responder;
    }

    FakeRouteProvider (Responder responder) {
        this(ProviderName.GOOGLE, true, responder);
    }

    @Override
    public ProviderName name () {
        return name;
    }

    @Override
    public ProbeOutcome query (Location origin, Location destination, Instant instant, SearchMode mode)
            throws IOException {
        calls.add(new Call(instant, mode));
        return responder.respond(instant, mode);
    }

    @Override
    public boolean isEnabled () {
        return enabled;
    }

    long callsInMode (SearchMode mode) {
        return calls.stream().filter(call -> call.mode == mode).count();
    }

}
