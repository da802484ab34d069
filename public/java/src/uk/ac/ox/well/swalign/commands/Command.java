package uk.ac.ox.well.swalign.commands;

public interface Command {
    void init();

    void execute();
}
