package automaton;

import utilities.DnaLogger;

/**
 * Observer notified once an automaton has finished construction.
 */
@FunctionalInterface
public interface BuildListener {

    BuildListener LOGGING = DnaLogger::info;

    BuildListener SILENT = message -> { };

    void onBuilt(String message);
}
