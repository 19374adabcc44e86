// Part of Recompose: https://recompose.machinezoo.com
/**
 * Transfer of server-rendered output to the client and its adoption there.
 *
 * @see com.machinezoo.recompose.hydration.HydrationManager
 */
package com.machinezoo.recompose.hydration;
