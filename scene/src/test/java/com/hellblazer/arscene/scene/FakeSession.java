package com.hellblazer.arscene.scene;

import java.util.ArrayList;
import java.util.List;

import com.hellblazer.arscene.geometry.Pose;
import com.hellblazer.arscene.tracking.Anchor;
import com.hellblazer.arscene.tracking.AnchorFuture;
import com.hellblazer.arscene.tracking.CloudAnchorState;
import com.hellblazer.arscene.tracking.Earth;
import com.hellblazer.arscene.tracking.Frame;
import com.hellblazer.arscene.tracking.HostResult;
import com.hellblazer.arscene.tracking.ResolveResult;
import com.hellblazer.arscene.tracking.SessionConfig;
import com.hellblazer.arscene.tracking.SessionConfig.DepthMode;
import com.hellblazer.arscene.tracking.TrackingSession;

/**
 * In memory tracking session. Frames are queued by the test; anchor tasks complete when the test says so.
 *
 * @author hal.hildebrand
 */
public class FakeSession implements TrackingSession {
    private final List<SessionConfig>                               configs        = new ArrayList<>();
    private final List<FakeAnchor>                                  created        = new ArrayList<>();
    private boolean                                                 depthSupported = true;
    private Earth                                                   earth;
    private Frame                                                   frame;
    private final List<FakeFuture<HostResult>>                      hosts          = new ArrayList<>();
    private final List<FakeFuture<ResolveResult<CloudAnchorState>>> resolves       = new ArrayList<>();

    @Override
    public void close() {
    }

    @Override
    public void configure(SessionConfig config) {
        configs.add(config);
    }

    @Override
    public Anchor createAnchor(Pose pose) {
        var anchor = new FakeAnchor(pose);
        created.add(anchor);
        return anchor;
    }

    @Override
    public FeatureMapQuality estimateFeatureMapQualityForHosting(Pose pose) {
        return FeatureMapQuality.SUFFICIENT;
    }

    @Override
    public CameraFacing getCameraFacing() {
        return CameraFacing.BACK;
    }

    /**
     * @return every configuration applied, in order
     */
    public List<SessionConfig> getConfigs() {
        return configs;
    }

    public List<FakeAnchor> getCreated() {
        return created;
    }

    @Override
    public Earth getEarth() {
        return earth;
    }

    public List<FakeFuture<HostResult>> getHosts() {
        return hosts;
    }

    public List<FakeFuture<ResolveResult<CloudAnchorState>>> getResolves() {
        return resolves;
    }

    @Override
    public AnchorFuture<HostResult> hostCloudAnchorAsync(Anchor anchor, int ttlDays) {
        var future = new FakeFuture<HostResult>();
        hosts.add(future);
        return future;
    }

    @Override
    public boolean isDepthModeSupported(DepthMode mode) {
        return depthSupported;
    }

    @Override
    public void pause() {
    }

    @Override
    public AnchorFuture<ResolveResult<CloudAnchorState>> resolveCloudAnchorAsync(String cloudAnchorId) {
        var future = new FakeFuture<ResolveResult<CloudAnchorState>>();
        resolves.add(future);
        return future;
    }

    @Override
    public void resume() {
    }

    @Override
    public void setDisplayGeometry(int rotation, int width, int height) {
    }

    public void setDepthSupported(boolean depthSupported) {
        this.depthSupported = depthSupported;
    }

    public void setEarth(Earth earth) {
        this.earth = earth;
    }

    public void setFrame(Frame frame) {
        this.frame = frame;
    }

    @Override
    public Frame update() {
        return frame;
    }
}
