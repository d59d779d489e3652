package co.fanki.blueprintmcp.graph.domain;

/**
 * A resolved link endpoint: the owning node's guid and the pin id.
 *
 * @param nodeGuid the guid of the node owning the pin
 * @param pinId the pin identifier
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PinReference(String nodeGuid, String pinId) {

    /**
     * Returns the key identifying this pin across the whole graph.
     *
     * @return {@code nodeGuid:pinId}
     */
    public String key() {
        return nodeGuid + ":" + pinId;
    }

}
