package nl.pim16aap2.beacon.launcher;

import java.net.URI;
import java.util.Objects;

/**
 * The remote services the launcher talks to.
 *
 * @param identityDeviceCodeUri
 *     The identity-provider endpoint that issues device codes.
 * @param identityTokenUri
 *     The identity-provider token endpoint used for device-code polling and refreshes.
 * @param brokerUserAuthUri
 *     The authorization-broker endpoint that exchanges an identity token for a user token.
 * @param brokerAuthorizeUri
 *     The authorization-broker endpoint that exchanges a user token for a service token.
 * @param gameLoginUri
 *     The game-service login endpoint.
 * @param gameProfileUri
 *     The game-service profile endpoint, also used to validate access tokens.
 * @param versionManifestUri
 *     The runtime version manifest.
 * @param loaderMetaUri
 *     The base URI of the loader metadata service.
 * @param assetBaseUri
 *     The base URI of the asset object store.
 * @param librariesBaseUri
 *     The repository used for libraries that do not declare their own download location.
 */
public record LauncherEndpoints(
    URI identityDeviceCodeUri,
    URI identityTokenUri,
    URI brokerUserAuthUri,
    URI brokerAuthorizeUri,
    URI gameLoginUri,
    URI gameProfileUri,
    URI versionManifestUri,
    URI loaderMetaUri,
    URI assetBaseUri,
    URI librariesBaseUri
)
{
    public LauncherEndpoints
    {
        Objects.requireNonNull(identityDeviceCodeUri, "identityDeviceCodeUri may not be null.");
        Objects.requireNonNull(identityTokenUri, "identityTokenUri may not be null.");
        Objects.requireNonNull(brokerUserAuthUri, "brokerUserAuthUri may not be null.");
        Objects.requireNonNull(brokerAuthorizeUri, "brokerAuthorizeUri may not be null.");
        Objects.requireNonNull(gameLoginUri, "gameLoginUri may not be null.");
        Objects.requireNonNull(gameProfileUri, "gameProfileUri may not be null.");
        Objects.requireNonNull(versionManifestUri, "versionManifestUri may not be null.");
        Objects.requireNonNull(loaderMetaUri, "loaderMetaUri may not be null.");
        Objects.requireNonNull(assetBaseUri, "assetBaseUri may not be null.");
        Objects.requireNonNull(librariesBaseUri, "librariesBaseUri may not be null.");
    }

    /**
     * The production endpoints.
     */
    public static LauncherEndpoints defaults()
    {
        return new LauncherEndpoints(
            URI.create("https://login.live.com/oauth20_connect.srf"),
            URI.create("https://login.live.com/oauth20_token.srf"),
            URI.create("https://user.auth.xboxlive.com/user/authenticate"),
            URI.create("https://xsts.auth.xboxlive.com/xsts/authorize"),
            URI.create("https://api.minecraftservices.com/authentication/login_with_xbox"),
            URI.create("https://api.minecraftservices.com/minecraft/profile"),
            URI.create("https://piston-meta.mojang.com/mc/game/version_manifest_v2.json"),
            URI.create("https://meta.fabricmc.net/v2"),
            URI.create("https://resources.download.minecraft.net"),
            URI.create("https://libraries.minecraft.net")
        );
    }

    /**
     * Creates endpoints that all live under one base URI, using the same paths as the production services.
     * <p>
     * This is useful for mirrors and for local test servers.
     *
     * @param baseUri
     *     The base URI, without a trailing slash.
     * @return the endpoints.
     */
    public static LauncherEndpoints underBaseUri(URI baseUri)
    {
        final String base = baseUri.toString().replaceAll("/+$", "");
        return new LauncherEndpoints(
            URI.create(base + "/oauth20_connect.srf"),
            URI.create(base + "/oauth20_token.srf"),
            URI.create(base + "/user/authenticate"),
            URI.create(base + "/xsts/authorize"),
            URI.create(base + "/authentication/login_with_xbox"),
            URI.create(base + "/minecraft/profile"),
            URI.create(base + "/mc/game/version_manifest_v2.json"),
            URI.create(base + "/v2"),
            URI.create(base + "/assets"),
            URI.create(base + "/libraries")
        );
    }
}
