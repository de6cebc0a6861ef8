package com.lhcz.pgcdc.model;

public enum Operation {
    INSERT,
    UPDATE,
    DELETE
}
