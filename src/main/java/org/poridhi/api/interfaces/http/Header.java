package org.poridhi.api.interfaces.http;

/** One response header line. Names keep the case they were added with. */
public record Header(String name, String value) {}
