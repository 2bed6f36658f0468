package uisnap.action;

/**
 * Something that changes the UI between two captures: a click, a key press, typing.
 * Input simulation itself lives outside this library.
 */
@FunctionalInterface
public interface UiAction {

    void perform() throws Exception;
}
