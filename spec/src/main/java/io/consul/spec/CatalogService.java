package io.consul.spec;

import static io.consul.util.Utils.defaultIfNull;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * A service instance defined within the catalog, flattened together with the node that hosts it.
 *
 * @param id the ID of the node
 * @param node the name of the node the service is associated with
 * @param address the address of the node
 * @param datacenter the datacenter of the node running the service
 * @param taggedAddresses addresses tagged to the node hosting the service
 * @param nodeMeta metadata attached to the node hosting the service
 * @param serviceId the ID of the service
 * @param serviceName the name of the service
 * @param serviceAddress the address of the service
 * @param serviceTags tags assigned to the service
 * @param serviceMeta metadata assigned to the service
 * @param servicePort the port of the service
 * @param serviceWeights the DNS weights of the service, {@code null} when the server did not report any
 * @param serviceEnableTagOverride whether anti-entropy leaves externally modified tags alone
 * @param createIndex the index at which the entry was created
 * @param modifyIndex the index at which the entry was last modified
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogService(@JsonProperty("ID") String id,
                             @JsonProperty("Node") String node,
                             @JsonProperty("Address") String address,
                             @JsonProperty("Datacenter") String datacenter,
                             @JsonProperty("TaggedAddresses") Map<String, String> taggedAddresses,
                             @JsonProperty("NodeMeta") Map<String, String> nodeMeta,
                             @JsonProperty("ServiceID") String serviceId,
                             @JsonProperty("ServiceName") String serviceName,
                             @JsonProperty("ServiceAddress") String serviceAddress,
                             @JsonProperty("ServiceTags") List<String> serviceTags,
                             @JsonProperty("ServiceMeta") Map<String, String> serviceMeta,
                             @JsonProperty("ServicePort") int servicePort,
                             @JsonProperty("ServiceWeights") @Nullable ServiceWeights serviceWeights,
                             @JsonProperty("ServiceEnableTagOverride") boolean serviceEnableTagOverride,
                             @JsonProperty("CreateIndex") @UnsignedLong long createIndex,
                             @JsonProperty("ModifyIndex") @UnsignedLong long modifyIndex) {

    public CatalogService {
        id = defaultIfNull(id, "");
        node = defaultIfNull(node, "");
        address = defaultIfNull(address, "");
        datacenter = defaultIfNull(datacenter, "");
        taggedAddresses = defaultIfNull(taggedAddresses, Map.of());
        nodeMeta = defaultIfNull(nodeMeta, Map.of());
        serviceId = defaultIfNull(serviceId, "");
        serviceName = defaultIfNull(serviceName, "");
        serviceAddress = defaultIfNull(serviceAddress, "");
        serviceTags = defaultIfNull(serviceTags, List.of());
        serviceMeta = defaultIfNull(serviceMeta, Map.of());
    }
}
