package com.browserpilot.core.command;

/**
 * Reference to a submitted command, handed back by {@link CommandOrchestrator#submit}.
 *
 * @param commandId     server-assigned id, or a local id for commands answered synchronously
 * @param sessionId     session the command runs on
 * @param resultEntryId id of the RESULT entry in the conversation log
 * @param polling       whether the command is being polled in the background
 */
public record CommandHandle(String commandId, String sessionId, String resultEntryId, boolean polling) {}
