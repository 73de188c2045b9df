package com.tcode.tunnel.trace;

public enum TraceCategory {
    CONNECTION,
    PORT,
    ERROR,
    GENERIC
}
