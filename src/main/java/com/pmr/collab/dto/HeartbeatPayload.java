package com.pmr.collab.dto;

import lombok.Data;

@Data
public class HeartbeatPayload implements WirePayload {
}
