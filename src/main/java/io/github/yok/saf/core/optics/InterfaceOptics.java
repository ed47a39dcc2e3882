package io.github.yok.saf.core.optics;

import lombok.Value;
import org.ejml.data.ZMatrixRMaj;

/**
 * 試料媒質 → カバーガラス → 液浸媒質の 3 層界面について、瞳サンプルごとの伝搬角余弦と Fresnel 透過係数を保持するクラスです。
 *
 * <p>
 * すべて瞳格子と同じ形状の複素行列です。開口外のサンプルは 0 のままです。
 * </p>
 */
@Value
public class InterfaceOptics {

    /**
     * 試料媒質中の cosθ です（エバネッセント領域では純虚数になります）。
     */
    ZMatrixRMaj cosMed;

    /**
     * カバーガラス中の cosθ です。
     */
    ZMatrixRMaj cosCov;

    /**
     * 実際の液浸媒質中の cosθ です。
     */
    ZMatrixRMaj cosImm;

    /**
     * 公称の液浸媒質中の cosθ です。
     */
    ZMatrixRMaj cosImmNom;

    /**
     * 試料媒質 → カバーガラス界面の P 偏光透過係数です。
     */
    ZMatrixRMaj fresnelPMedCov;

    /**
     * 試料媒質 → カバーガラス界面の S 偏光透過係数です。
     */
    ZMatrixRMaj fresnelSMedCov;

    /**
     * カバーガラス → 液浸媒質界面の P 偏光透過係数です。
     */
    ZMatrixRMaj fresnelPCovImm;

    /**
     * カバーガラス → 液浸媒質界面の S 偏光透過係数です。
     */
    ZMatrixRMaj fresnelSCovImm;

    /**
     * 2 界面を通した P 偏光透過係数です。
     */
    ZMatrixRMaj fresnelP;

    /**
     * 2 界面を通した S 偏光透過係数です。
     */
    ZMatrixRMaj fresnelS;
}
