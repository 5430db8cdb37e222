package it.aw.dms.service.llm;

import java.time.Duration;

/** Attesa tra due tentativi; sostituibile nei test. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
