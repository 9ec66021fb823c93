/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.chatbridge.adapter.inbound.command;

import me.golemcore.chatbridge.domain.model.ChatSession;
import me.golemcore.chatbridge.domain.model.Modalities;
import me.golemcore.chatbridge.domain.model.ModelSelector;
import me.golemcore.chatbridge.domain.model.Provider;
import me.golemcore.chatbridge.domain.model.ResponseFormat;
import me.golemcore.chatbridge.infrastructure.config.BridgeProperties;
import me.golemcore.chatbridge.plugin.context.PluginPipeline;
import me.golemcore.chatbridge.port.inbound.CommandPort;
import me.golemcore.chatbridge.port.outbound.ModelCatalogPort;
import me.golemcore.chatbridge.port.outbound.ProviderRegistryPort;
import me.golemcore.chatbridge.port.outbound.SessionPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Routes slash commands to appropriate handlers.
 *
 * <ul>
 * <li>/help, /start - Show available commands
 * <li>/clear - Reset the conversation
 * <li>/status - Show model, round limit and usage
 * <li>/maxrounds [n] - Show or set the round limit
 * <li>/format [auto|text|image|both] - Reply format and image output settings
 * <li>/model [provider:model] - Show or switch the model
 * <li>/models [filter] - List OpenRouter models
 * <li>/stop - Stop the current run (handled by the run coordinator)
 * </ul>
 *
 * <p>
 * Commands contributed by extensions are routed through the plugin pipeline. In
 * kiosk mode the model selection commands are locked and extension commands not
 * marked as kiosk-safe are hidden.
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_HELP = "help";
    private static final String CMD_START = "start";
    private static final String CMD_CLEAR = "clear";
    private static final String CMD_STATUS = "status";
    private static final String CMD_MAXROUNDS = "maxrounds";
    private static final String CMD_FORMAT = "format";
    private static final String CMD_MODEL = "model";
    private static final String CMD_MODELS = "models";
    private static final String CMD_STOP = "stop";
    private static final String OPTION_OFF = "off";
    private static final int MAX_LISTED_MODELS = 100;

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_HELP, CMD_START, CMD_CLEAR, CMD_STATUS, CMD_MAXROUNDS, CMD_FORMAT, CMD_MODEL, CMD_MODELS,
            CMD_STOP);

    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);
    private static final Set<String> KIOSK_LOCKED_COMMANDS = Set.of(CMD_MAXROUNDS, CMD_MODEL, CMD_MODELS);

    static final List<String> VALID_ASPECT_RATIOS = List.of("1:1", "16:9", "9:16", "4:3", "3:4");
    static final List<String> VALID_IMAGE_SIZES = List.of("SD", "HD", "4K");

    private final SessionPort sessionService;
    private final ModelCatalogPort modelCatalog;
    private final ProviderRegistryPort providerRegistry;
    private final PluginPipeline pluginPipeline;
    private final BridgeProperties properties;

    public CommandRouter(
            SessionPort sessionService,
            ModelCatalogPort modelCatalog,
            ProviderRegistryPort providerRegistry,
            PluginPipeline pluginPipeline,
            BridgeProperties properties) {
        this.sessionService = sessionService;
        this.modelCatalog = modelCatalog;
        this.providerRegistry = providerRegistry;
        this.pluginPipeline = pluginPipeline;
        this.properties = properties;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CommandResult execute(String command, List<String> args, String chatId) {
        log.debug("Executing command: /{} (chat={})", command, chatId);
        if (properties.isKioskMode() && KIOSK_LOCKED_COMMANDS.contains(command)) {
            return CommandResult.failure("Command /" + command + " is not available in kiosk mode.");
        }
        if (!KNOWN_COMMAND_SET.contains(command)) {
            return executePluginCommand(command, chatId);
        }

        return switch (command) {
        case CMD_HELP, CMD_START -> handleHelp();
        case CMD_CLEAR -> handleClear(chatId);
        case CMD_STATUS -> handleStatus(chatId);
        case CMD_MAXROUNDS -> handleMaxRounds(args, chatId);
        case CMD_FORMAT -> handleFormat(args, chatId);
        case CMD_MODEL -> handleModel(args, chatId);
        case CMD_MODELS -> handleModels(args);
        case CMD_STOP -> CommandResult.success("Nothing is running.");
        default -> CommandResult.failure("Unknown command: /" + command);
        };
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command)
                || pluginPipeline.listCommands(properties.isKioskMode()).containsKey(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        boolean kiosk = properties.isKioskMode();
        List<CommandDefinition> commands = new ArrayList<>(List.of(
                new CommandDefinition(CMD_HELP, "Show available commands", "/help"),
                new CommandDefinition(CMD_CLEAR, "Clear the conversation", "/clear"),
                new CommandDefinition(CMD_STATUS, "Show session status", "/status"),
                new CommandDefinition(CMD_FORMAT, "Reply format and image settings",
                        "/format [auto|text|image|both] | modalities <m> | ratio <r|off> | size <s|off>")));
        if (!kiosk) {
            commands.add(new CommandDefinition(CMD_MAXROUNDS, "Show or set the round limit", "/maxrounds [n]"));
            commands.add(new CommandDefinition(CMD_MODEL, "Show or switch the model", "/model [provider:model]"));
            commands.add(new CommandDefinition(CMD_MODELS, "List OpenRouter models", "/models [filter]"));
        }
        commands.add(new CommandDefinition(CMD_STOP, "Stop the current run", "/stop"));
        for (Map.Entry<String, String> entry : pluginPipeline.listCommands(kiosk).entrySet()) {
            if (!KNOWN_COMMAND_SET.contains(entry.getKey())) {
                commands.add(new CommandDefinition(entry.getKey(), entry.getValue(), "/" + entry.getKey()));
            }
        }
        return commands;
    }

    private CommandResult executePluginCommand(String command, String chatId) {
        ChatSession session = sessionService.getOrCreate(chatId);
        PluginPipeline.CommandOutcome outcome = pluginPipeline.executeCommand(command, session,
                properties.isKioskMode());
        return switch (outcome) {
        case HANDLED -> CommandResult.success(null);
        case FAILED -> CommandResult.failure("Command /" + command + " failed. Please try again later.");
        case NOT_FOUND -> CommandResult.failure("Unknown command: /" + command);
        };
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Available commands:\n");
        for (CommandDefinition definition : listCommands()) {
            sb.append("\n").append(definition.usage()).append(" - ").append(definition.description());
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleClear(String chatId) {
        sessionService.clear(chatId);
        return CommandResult.success("Context cleared");
    }

    private CommandResult handleStatus(String chatId) {
        ChatSession session = sessionService.getOrCreate(chatId);
        StringBuilder sb = new StringBuilder();
        synchronized (session) {
            sb.append("Model: ").append(session.getModel().qualifiedName()).append("\n");
            sb.append("Max rounds: ").append(session.getMaxRounds()).append("\n");
            sb.append("Conversation length: ").append(session.getConversation().size()).append("\n");
            sb.append("Tokens used: ").append(session.getTokensUsed()).append("\n");
            sb.append("Format: ").append(session.getResponseFormat().id()).append("\n");
            sb.append("Modalities: ").append(session.getModalities().id());
            if (session.getAspectRatio() != null) {
                sb.append("\nAspect ratio: ").append(session.getAspectRatio());
            }
            if (session.getImageSize() != null) {
                sb.append("\nImage size: ").append(session.getImageSize());
            }
        }
        return CommandResult.success(sb.toString());
    }

    private CommandResult handleMaxRounds(List<String> args, String chatId) {
        if (args.isEmpty()) {
            return CommandResult.success("Max rounds is currently set to "
                    + sessionService.getOrCreate(chatId).getMaxRounds());
        }
        int requested;
        try {
            requested = Integer.parseInt(args.get(0));
        } catch (NumberFormatException e) {
            requested = 0;
        }
        sessionService.setMaxRounds(chatId, requested);
        int applied = sessionService.getOrCreate(chatId).getMaxRounds();
        sessionService.trim(chatId);
        return CommandResult.success("Max rounds set to " + applied);
    }

    private CommandResult handleFormat(List<String> args, String chatId) {
        ChatSession session = sessionService.getOrCreate(chatId);
        if (args.isEmpty()) {
            return CommandResult.success("Format: " + session.getResponseFormat().id()
                    + "\nModalities: " + session.getModalities().id()
                    + "\nAspect ratio: " + orNone(session.getAspectRatio())
                    + "\nImage size: " + orNone(session.getImageSize()));
        }

        String option = args.get(0).toLowerCase(Locale.ROOT);
        if (ResponseFormat.isValid(option)) {
            ResponseFormat format = ResponseFormat.fromId(option);
            sessionService.setResponseFormat(chatId, format);
            return CommandResult.success("Format set to " + format.id());
        }
        if (args.size() < 2) {
            return CommandResult.failure(formatUsage());
        }

        String value = args.get(1);
        return switch (option) {
        case "modalities" -> setModalities(session, chatId, value);
        case "ratio" -> setAspectRatio(session, chatId, value);
        case "size" -> setImageSize(session, chatId, value);
        default -> CommandResult.failure(formatUsage());
        };
    }

    private CommandResult setModalities(ChatSession session, String chatId, String value) {
        Modalities modalities;
        try {
            modalities = Modalities.fromId(value);
        } catch (IllegalArgumentException e) {
            return CommandResult.failure("Invalid modalities: " + value + ". Use auto, text, image or text+image.");
        }
        sessionService.setImageSettings(chatId, modalities, session.getAspectRatio(), session.getImageSize());
        return CommandResult.success("Modalities set to " + modalities.id());
    }

    private CommandResult setAspectRatio(ChatSession session, String chatId, String value) {
        String ratio = OPTION_OFF.equalsIgnoreCase(value) ? null : value;
        if (ratio != null && !VALID_ASPECT_RATIOS.contains(ratio)) {
            return CommandResult.failure("Invalid aspect ratio: " + value + ". Use one of "
                    + String.join(", ", VALID_ASPECT_RATIOS) + " or off.");
        }
        sessionService.setImageSettings(chatId, session.getModalities(), ratio, session.getImageSize());
        return CommandResult.success("Aspect ratio set to " + orNone(ratio));
    }

    private CommandResult setImageSize(ChatSession session, String chatId, String value) {
        String size = OPTION_OFF.equalsIgnoreCase(value) ? null : value.toUpperCase(Locale.ROOT);
        if (size != null && !VALID_IMAGE_SIZES.contains(size)) {
            return CommandResult.failure("Invalid image size: " + value + ". Use one of "
                    + String.join(", ", VALID_IMAGE_SIZES) + " or off.");
        }
        sessionService.setImageSettings(chatId, session.getModalities(), session.getAspectRatio(), size);
        return CommandResult.success("Image size set to " + orNone(size));
    }

    private CommandResult handleModel(List<String> args, String chatId) {
        if (args.isEmpty()) {
            return CommandResult.success("Current model: "
                    + sessionService.getOrCreate(chatId).getModel().qualifiedName());
        }
        String requested = args.get(0);
        ModelSelector selector;
        try {
            selector = ModelSelector.parse(requested);
        } catch (IllegalArgumentException e) {
            return CommandResult.failure("Invalid model: " + requested);
        }
        if (!providerRegistry.getAvailableProviders().contains(selector.provider())) {
            return CommandResult.failure("Provider " + selector.provider().id() + " is not configured");
        }
        if (selector.provider() == Provider.OPENROUTER && !modelCatalog.contains(selector.modelId())) {
            return CommandResult.failure("Model name " + selector.modelId() + " not found in list of models");
        }
        sessionService.setModel(chatId, selector);
        log.info("[Commands] model changed: chatId={}, model={}", chatId, selector.qualifiedName());
        return CommandResult.success("Model has been changed to " + selector.qualifiedName());
    }

    private CommandResult handleModels(List<String> args) {
        String query = args.isEmpty() ? null : String.join(" ", args);
        List<String> models = query == null ? modelCatalog.listModels() : modelCatalog.filter(query, false);
        if (models.isEmpty()) {
            return CommandResult.success(query == null
                    ? "Model list is unavailable right now."
                    : "No models match \"" + query + "\".");
        }
        String listing = models.stream()
                .limit(MAX_LISTED_MODELS)
                .collect(Collectors.joining("\n"));
        if (models.size() > MAX_LISTED_MODELS) {
            listing += "\n... and " + (models.size() - MAX_LISTED_MODELS) + " more. Add a filter to narrow down.";
        }
        return CommandResult.success("OpenRouter models (" + models.size() + "):\n" + listing);
    }

    private static String formatUsage() {
        return "Usage: /format [auto|text|image|both]\n"
                + "/format modalities <auto|text|image|text+image>\n"
                + "/format ratio <" + String.join("|", VALID_ASPECT_RATIOS) + "|off>\n"
                + "/format size <" + String.join("|", VALID_IMAGE_SIZES) + "|off>";
    }

    private static String orNone(String value) {
        return value != null ? value : "none";
    }
}
