/*******************************************************************************
* Copyright (c) 2024 Microsoft Corporation and others.
* All rights reserved. This program and the accompanying materials
* are made available under the terms of the Eclipse Public License v1.0
* which accompanies this distribution, and is available at
* http://www.eclipse.org/legal/epl-v10.html
*
* Contributors:
*     Microsoft Corporation - initial API and implementation
*******************************************************************************/

package com.microsoft.java.debug.agent;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import org.apache.commons.lang3.StringUtils;

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

public final class AgentSettings {
    private static final Logger logger = Logger.getLogger(Configuration.LOGGER_NAME);
    public static final int DEFAULT_MAX_DEBUG_THREADS = 10;
    private static Set<IAgentSettingChangeListener> listeners =
        Collections.newSetFromMap(new ConcurrentHashMap<IAgentSettingChangeListener, Boolean>());
    private static volatile AgentSettings current = loadDefaults();

    public String logLevel;
    public boolean vthreadsSupported = true;
    public boolean rememberVThreadsWhenDisconnected = false;
    public int maxDebugThreads = DEFAULT_MAX_DEBUG_THREADS;
    public boolean assertOn = false;
    public boolean evictResumedVThreads = true;
    public TraceMode trace = TraceMode.OFF;

    public AgentSettings() {

    }

    public static AgentSettings getCurrent() {
        return current;
    }

    /**
     * Parse the settings from a json string. Invalid json or values are
     * logged and the default settings are returned instead.
     *
     * @param jsonSettings
     *            the settings represented in json format.
     * @return the parsed settings
     */
    public static AgentSettings fromJson(String jsonSettings) {
        if (StringUtils.isBlank(jsonSettings)) {
            return new AgentSettings();
        }
        try {
            AgentSettings settings = JsonUtils.fromJson(jsonSettings, AgentSettings.class);
            if (settings == null) {
                return new AgentSettings();
            }
            if (settings.maxDebugThreads <= 0) {
                logger.warning(String.format("Invalid maxDebugThreads %d, using %d", settings.maxDebugThreads,
                        DEFAULT_MAX_DEBUG_THREADS));
                settings.maxDebugThreads = DEFAULT_MAX_DEBUG_THREADS;
            }
            return settings;
        } catch (JsonParseException ex) {
            logger.severe(String.format("Invalid json for agent settings: %s, %s", jsonSettings, ex.getMessage()));
            return new AgentSettings();
        }
    }

    /**
     * Update current settings with the values in the parameter.
     *
     * @param jsonSettings
     *            the new settings represents in json format.
     */
    public static void updateSettings(String jsonSettings) {
        AgentSettings oldSettings = current;
        current = fromJson(jsonSettings);
        Log.setLevel(current.logLevel);
        for (IAgentSettingChangeListener listener : listeners) {
            listener.update(oldSettings, current);
        }
    }

    public String toJson() {
        return JsonUtils.toJson(this);
    }

    private static AgentSettings loadDefaults() {
        try (InputStream in = AgentSettings.class.getClassLoader().getResourceAsStream(Configuration.SETTINGS_RESOURCE)) {
            if (in == null) {
                return new AgentSettings();
            }
            AgentSettings settings = fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            Log.setLevel(settings.logLevel);
            return settings;
        } catch (IOException ex) {
            logger.warning(String.format("Failed to read %s: %s", Configuration.SETTINGS_RESOURCE, ex.getMessage()));
            return new AgentSettings();
        }
    }

    public static boolean addAgentSettingChangeListener(IAgentSettingChangeListener listener) {
        return listeners.add(listener);
    }

    public static boolean removeAgentSettingChangeListener(IAgentSettingChangeListener listener) {
        return listeners.remove(listener);
    }

    public static enum TraceMode {
        @SerializedName("off")
        OFF,
        @SerializedName("threads")
        THREADS
    }

    public static interface IAgentSettingChangeListener {
        public void update(AgentSettings oldSettings, AgentSettings newSettings);
    }
}
