package com.pmr.collab.model;

import lombok.Value;

/**
 * Latest known pointer of a remote collaborator. Superseded by the next update from the same user.
 */
@Value
public class CursorPosition {
    String userId;
    String userName;
    String sectionId;
    Position position;
    String color;
}
