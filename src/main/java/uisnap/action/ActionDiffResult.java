package uisnap.action;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import uisnap.model.Snapshot;
import uisnap.model.TraversalDiff;

/**
 * Outcome of {@link ActionDiffCoordinator#perform}: the captures on either side of the
 * action, their diff, and any error met along the way. Failures are recorded here as
 * messages rather than thrown, so a failed action still reports what the UI looked like.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionDiffResult {

    @JsonProperty("traversalBefore")
    private Snapshot before;

    @JsonProperty("traversalAfter")
    private Snapshot after;

    @JsonProperty("traversalDiff")
    private TraversalDiff diff;

    @JsonProperty("actionError")
    private String actionError;

    @JsonProperty("traversalBeforeError")
    private String beforeError;

    @JsonProperty("traversalAfterError")
    private String afterError;

    public Snapshot      getBefore()      { return before; }
    public Snapshot      getAfter()       { return after; }
    public TraversalDiff getDiff()        { return diff; }
    public String        getActionError() { return actionError; }
    public String        getBeforeError() { return beforeError; }
    public String        getAfterError()  { return afterError; }

    void setBefore(Snapshot before)        { this.before = before; }
    void setAfter(Snapshot after)          { this.after = after; }
    void setDiff(TraversalDiff diff)       { this.diff = diff; }
    void setActionError(String error)      { this.actionError = error; }
    void setBeforeError(String error)      { this.beforeError = error; }
    void setAfterError(String error)       { this.afterError = error; }

    /** True when both captures, the action and the diff all succeeded. */
    @JsonIgnore
    public boolean isComplete() {
        return diff != null && actionError == null && beforeError == null && afterError == null;
    }

    @Override
    public String toString() {
        return String.format("ActionDiffResult{before=%s, after=%s, diff=%s, actionError=%s}",
                before, after, diff, actionError);
    }
}
