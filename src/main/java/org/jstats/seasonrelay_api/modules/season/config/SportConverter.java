package org.jstats.seasonrelay_api.modules.season.config;

import org.jstats.seasonrelay_api.modules.season.model.Sport;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/** Binds {@code {sport}} path variables by their lowercase code, case-insensitively. */
@Component
public class SportConverter implements Converter<String, Sport> {

    @Override
    public Sport convert(String source) {
        return Sport.fromCode(source);
    }
}
