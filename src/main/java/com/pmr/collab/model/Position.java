package com.pmr.collab.model;

import lombok.Value;

@Value
public class Position {
    double x;
    double y;
}
