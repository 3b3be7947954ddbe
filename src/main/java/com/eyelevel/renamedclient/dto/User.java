package com.eyelevel.renamedclient.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The account the API key belongs to.
 *
 * @param credits Remaining credits.
 * @param team    The user's team, or null when the user has none.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(String id, String email, String name, Integer credits, Team team) {
}
