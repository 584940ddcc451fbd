package com.example.roster.cli;

import com.example.roster.model.LayoutOverride;
import picocli.CommandLine;

public class LayoutOverrideConverter implements CommandLine.ITypeConverter<LayoutOverride> {

    @Override
    public LayoutOverride convert(String value) {
        return LayoutOverride.from(value);
    }
}
