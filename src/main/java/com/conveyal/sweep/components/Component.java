package com.conveyal.sweep.components;

/**
 * These are the top-level modules of the sweep service that are instantiated and wired up to one another when the
 * application starts up. There is typically only one instance of each component, and all references to the component
 * are final.
 *
 * Currently this is a marker interface with no methods, just to indicate the role of certain classes in the project.
 *
 * All Components should be threadsafe: they must not fail when concurrently used by multiple HTTP handler threads.
 */
public interface Component {

}
