package com.aacprocessors.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-adapter defaults and scratch space settings.
 *
 * <p>Vendor fields the tree does not model (command names, container entry names,
 * locale, format version) are synthesized from these tables whenever a processor writes
 * a tree that came from another format. Missing sections and fields fall back to
 * {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * workspace:
 *   prefix: "aac-processors-"
 *
 * obf:
 *   locale: "nb_NO"
 *
 * snap:
 *   archived: false
 * }</pre>
 *
 * @param workspace scratch directory settings
 * @param gridset Grid 3 defaults
 * @param obf Open Board defaults
 * @param touchChat TouchChat defaults
 * @param snap Snap defaults
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProcessorConfig(
    @JsonProperty("workspace") WorkspaceConfig workspace,
    @JsonProperty("gridset") GridsetDefaults gridset,
    @JsonProperty("obf") ObfDefaults obf,
    @JsonProperty("touchchat") TouchChatDefaults touchChat,
    @JsonProperty("snap") SnapDefaults snap
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProcessorConfig {
        if (workspace == null) {
            workspace = new WorkspaceConfig(null, null);
        }
        if (gridset == null) {
            gridset = new GridsetDefaults(null, null, null, null, null, null);
        }
        if (obf == null) {
            obf = new ObfDefaults(null, null, null, null, null);
        }
        if (touchChat == null) {
            touchChat = new TouchChatDefaults(null, null, null, null, null, null);
        }
        if (snap == null) {
            snap = new SnapDefaults(null, null, null, null, null);
        }
    }

    /**
     * Creates the built-in configuration.
     *
     * @return default configuration
     */
    public static ProcessorConfig defaults() {
        return new ProcessorConfig(null, null, null, null, null);
    }

    /**
     * Scratch directory settings.
     *
     * @param prefix name prefix of temporary directories
     * @param directory parent directory (null = system temp directory)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WorkspaceConfig(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("directory") String directory
    ) {
        public WorkspaceConfig {
            if (prefix == null || prefix.isBlank()) {
                prefix = "aac-processors-";
            }
        }
    }

    /**
     * Grid 3 defaults.
     *
     * @param gridsDirectory archive directory holding one folder per grid
     * @param settingsEntry archive entry holding the start grid
     * @param fileMapEntry archive entry listing grid documents
     * @param speakCommand command written for SPEAK buttons
     * @param jumpCommand command written for NAVIGATE buttons
     * @param actionCommand command written for ACTION buttons
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GridsetDefaults(
        @JsonProperty("gridsDirectory") String gridsDirectory,
        @JsonProperty("settingsEntry") String settingsEntry,
        @JsonProperty("fileMapEntry") String fileMapEntry,
        @JsonProperty("speakCommand") String speakCommand,
        @JsonProperty("jumpCommand") String jumpCommand,
        @JsonProperty("actionCommand") String actionCommand
    ) {
        public GridsetDefaults {
            gridsDirectory = orDefault(gridsDirectory, "Grids");
            settingsEntry = orDefault(settingsEntry, "Settings0/settings.xml");
            fileMapEntry = orDefault(fileMapEntry, "FileMap.xml");
            speakCommand = orDefault(speakCommand, "Action.InsertText");
            jumpCommand = orDefault(jumpCommand, "Jump.To");
            actionCommand = orDefault(actionCommand, "Action.Clear");
        }
    }

    /**
     * Open Board defaults.
     *
     * @param format value of the {@code format} field of written boards
     * @param locale value of the {@code locale} field of written boards
     * @param boardsDirectory archive directory for boards inside an {@code .obz}
     * @param manifestEntry archive entry of the manifest
     * @param action {@code action} value written for ACTION buttons
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ObfDefaults(
        @JsonProperty("format") String format,
        @JsonProperty("locale") String locale,
        @JsonProperty("boardsDirectory") String boardsDirectory,
        @JsonProperty("manifestEntry") String manifestEntry,
        @JsonProperty("action") String action
    ) {
        public ObfDefaults {
            format = orDefault(format, "open-board-0.1");
            locale = orDefault(locale, "en_US");
            boardsDirectory = orDefault(boardsDirectory, "boards");
            manifestEntry = orDefault(manifestEntry, "manifest.json");
            action = orDefault(action, ":clear");
        }
    }

    /**
     * TouchChat defaults.
     *
     * @param storeEntry archive entry name of a newly created store
     * @param homePageName {@code special_pages} name marking the root page
     * @param navigateActionCode action code of page navigation
     * @param targetDataKey {@code action_data} key holding the target page
     * @param actionCode action code written for ACTION buttons
     * @param typeActionCode action code whose data names the type of a SPEAK or EMPTY button
     *     that its texts alone would misclassify
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TouchChatDefaults(
        @JsonProperty("storeEntry") String storeEntry,
        @JsonProperty("homePageName") String homePageName,
        @JsonProperty("navigateActionCode") Integer navigateActionCode,
        @JsonProperty("targetDataKey") Integer targetDataKey,
        @JsonProperty("actionCode") Integer actionCode,
        @JsonProperty("typeActionCode") Integer typeActionCode
    ) {
        public TouchChatDefaults {
            storeEntry = orDefault(storeEntry, "vocab.c4v");
            homePageName = orDefault(homePageName, "Home");
            navigateActionCode = navigateActionCode == null ? 1 : navigateActionCode;
            targetDataKey = targetDataKey == null ? 1 : targetDataKey;
            actionCode = actionCode == null ? 2 : actionCode;
            typeActionCode = typeActionCode == null ? 9000 : typeActionCode;
        }
    }

    /**
     * Snap defaults.
     *
     * @param storeEntry archive entry name of the store when archived
     * @param archived whether new pagesets are written as a zip around the store
     * @param actionCommands serialized command sequence written for ACTION buttons
     * @param speakCommands serialized command sequence marking a SPEAK button without text
     * @param emptyCommands serialized command sequence marking an EMPTY button with text
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SnapDefaults(
        @JsonProperty("storeEntry") String storeEntry,
        @JsonProperty("archived") Boolean archived,
        @JsonProperty("actionCommands") String actionCommands,
        @JsonProperty("speakCommands") String speakCommands,
        @JsonProperty("emptyCommands") String emptyCommands
    ) {
        public SnapDefaults {
            storeEntry = orDefault(storeEntry, "pageset.sps");
            archived = archived == null ? Boolean.TRUE : archived;
            actionCommands = orDefault(actionCommands, "[{\"$type\":\"ClearMessageWindowCommand\"}]");
            speakCommands = orDefault(speakCommands, "[{\"$type\":\"SpeakMessageCommand\"}]");
            emptyCommands = orDefault(emptyCommands, "[]");
        }
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
