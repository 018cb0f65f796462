package win.ixuni.ferry.core.http;

import lombok.Data;
import win.ixuni.ferry.core.copy.CopyHook;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-request orchestration state
 * <p>
 * Travels with the {@link ProxyRequest} down the pipeline. Never shared
 * between client requests.
 */
@Data
public class RequestContext {

    /**
     * Method the client sent, before COPY/POST got rewritten into PUT
     */
    private String originalMethod;

    /**
     * Set when an object POST is being served as a copy onto itself
     */
    private boolean postAsCopy;

    /**
     * Lets an upper middleware replace the fetched copy source. {@code null}
     * means the source response is used as is.
     */
    private CopyHook copyHook;

    /**
     * Tag of the middleware that issued this request ("SSC", "DM"); {@code null} for client requests
     */
    private String source;

    /**
     * Extra fields for the request log line
     */
    private List<String> logInfo = new ArrayList<>();

    /**
     * Copy handed to sub-requests
     */
    public RequestContext copy() {
        RequestContext copy = new RequestContext();
        copy.setOriginalMethod(originalMethod);
        copy.setPostAsCopy(postAsCopy);
        copy.setCopyHook(copyHook);
        copy.setSource(source);
        copy.setLogInfo(new ArrayList<>(logInfo));
        return copy;
    }

    public void addLogInfo(String info) {
        logInfo.add(info);
    }
}
