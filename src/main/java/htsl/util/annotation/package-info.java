// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Nullness annotations built on JSR 305 meta-annotations.
 */
package htsl.util.annotation;
