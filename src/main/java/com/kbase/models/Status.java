package com.kbase.models;

import java.util.Objects;

public class Status {

    private final int id;
    private final String name;
    private final boolean closed;

    public Status(int id, String name, boolean closed) {
        this.id = id;
        this.name = name;
        this.closed = closed;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "Status{" + id + ", '" + name + "'" + (closed ? ", closed" : "") + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Status status = (Status) o;
        return id == status.id && closed == status.closed && Objects.equals(name, status.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, closed);
    }
}
