package com.example.roster.dto.layout;

import lombok.Value;

/**
 * A delegation label found on a page. It owns every paragraph below it up to the next header.
 */
@Value
public class Header {
    String name;
    double midY;
}
