package org.fedcomp.util;

/** Marker for classes whose logging level can be set in the {@link Logger}. */
public interface IWritesLogs {}
