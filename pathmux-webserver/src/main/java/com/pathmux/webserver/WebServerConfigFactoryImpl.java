package com.pathmux.webserver;

import com.pathmux.router.RoutePrecedence;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import javax.inject.Singleton;
import javax.json.Json;
import javax.json.JsonException;
import javax.json.JsonObject;

/**
   Reads a {@link WebServerConfig} from a JSON file such as:

   <pre>
   { "host": "127.0.0.1", "port": 8080, "routePrecedence": "REGISTRATION_ORDER" }
   </pre>

   Every key is optional.
*/
@Singleton
public class WebServerConfigFactoryImpl implements WebServerConfig.Factory {
    protected WebServerConfigFactoryImpl() {}

    @Override
    public WebServerConfig create(File file) {
        if ( ! file.exists() ) {
            throw new IllegalArgumentException("Expected file '"+file+"' to exist");
        }
        JsonObject obj;
        try ( FileInputStream is = new FileInputStream(file) ) {
            obj = Json.createReader(is).readObject();
        } catch ( IOException ex ) {
            throw new UncheckedIOException(ex);
        } catch ( JsonException ex ) {
            throw new IllegalArgumentException("Expected '"+file+"' to contain a JSON object: "+ex.getMessage(), ex);
        }
        return WebServerConfig.builder()
            .host(getString(obj, "host"))
            .port(toPort(getInteger(obj, "port"), file))
            .routePrecedence(toRoutePrecedence(getString(obj, "routePrecedence"), file))
            .build();
    }

    private static Integer toPort(Integer port, File file) {
        if ( null == port ) return null;
        if ( port < 0 || port > 65535 ) {
            throw new IllegalArgumentException(
                "Expected 'port' to be between 0 and 65535 in "+file+", got "+port);
        }
        return port;
    }

    private static RoutePrecedence toRoutePrecedence(String precedence, File file) {
        if ( null == precedence ) return null;
        try {
            return RoutePrecedence.valueOf(precedence.toUpperCase(Locale.ROOT));
        } catch ( IllegalArgumentException ex ) {
            throw new IllegalArgumentException(
                "Expected 'routePrecedence' to be one of REGISTRATION_ORDER or MOST_SPECIFIC in "+
                file+", got '"+precedence+"'", ex);
        }
    }

    private static Integer getInteger(JsonObject obj, String field) {
        if ( null == obj || ! obj.containsKey(field) || obj.isNull(field) ) return null;
        try {
            return obj.getInt(field);
        } catch ( ClassCastException ex ) {
            String str = getString(obj, field);
            if ( null == str ) return null;
            try {
                return Integer.parseInt(str.trim());
            } catch ( NumberFormatException nfe ) {
                throw new IllegalArgumentException(
                    "Expected '"+field+"' to be an integer, got '"+str+"'", nfe);
            }
        }
    }

    private static String getString(JsonObject obj, String field) {
        if ( null == obj || ! obj.containsKey(field) ) return null;
        try {
            return obj.getString(field);
        } catch ( ClassCastException ex ) {
            return null;
        }
    }
}
